package dualstore.spring.boot;

import dualstore.jdbc.remote.CacheSpec;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the dualstore auto-configuration.
 *
 * <p>All properties are under the {@code dualstore} prefix. Durations accept Spring Boot's
 * formats ({@code 800ms}, {@code 30s}, {@code PT5M}).
 */
@ConfigurationProperties(prefix = "dualstore")
public class DualStoreProperties {

  /** Skip the remote store and run in DISABLED mode. */
  private boolean forceOffline = false;

  /** Queue a remote write that fails in REMOTE mode for later replay. */
  private boolean queueFailedRemoteWrites = true;

  /** Probe timeout used at startup and by reconnect attempts. */
  private Duration initialHealthCheckTimeout = Duration.ofMillis(3000);

  /** Probe timeout used by the periodic health check. */
  private Duration healthCheckTimeout = Duration.ofMillis(2000);

  /** Deadline for a single remote read. */
  private Duration readTimeout = Duration.ofMillis(800);

  /** Deadline for a single remote write. */
  private Duration writeTimeout = Duration.ofMillis(1000);

  /** Interval between health checks while the remote store is in use. */
  private Duration healthCheckInterval = Duration.ofSeconds(30);

  /** Delay before each reconnect attempt in LOCAL mode. */
  private Duration reconnectDelay = Duration.ofMinutes(5);

  /** Threads available for deadline-bounded remote calls. */
  private int remoteWorkers = 4;

  /** Remote calls allowed to wait for a worker before further calls fall back to local. */
  private int remoteQueueCapacity = 64;

  private Local local = new Local();
  private Remote remote = new Remote();
  private Sync sync = new Sync();
  private Queue queue = new Queue();
  private Cache cache = new Cache();
  private Metrics metrics = new Metrics();

  public boolean isForceOffline() {
    return forceOffline;
  }

  public void setForceOffline(boolean forceOffline) {
    this.forceOffline = forceOffline;
  }

  public boolean isQueueFailedRemoteWrites() {
    return queueFailedRemoteWrites;
  }

  public void setQueueFailedRemoteWrites(boolean queueFailedRemoteWrites) {
    this.queueFailedRemoteWrites = queueFailedRemoteWrites;
  }

  public Duration getInitialHealthCheckTimeout() {
    return initialHealthCheckTimeout;
  }

  public void setInitialHealthCheckTimeout(Duration initialHealthCheckTimeout) {
    this.initialHealthCheckTimeout = initialHealthCheckTimeout;
  }

  public Duration getHealthCheckTimeout() {
    return healthCheckTimeout;
  }

  public void setHealthCheckTimeout(Duration healthCheckTimeout) {
    this.healthCheckTimeout = healthCheckTimeout;
  }

  public Duration getReadTimeout() {
    return readTimeout;
  }

  public void setReadTimeout(Duration readTimeout) {
    this.readTimeout = readTimeout;
  }

  public Duration getWriteTimeout() {
    return writeTimeout;
  }

  public void setWriteTimeout(Duration writeTimeout) {
    this.writeTimeout = writeTimeout;
  }

  public Duration getHealthCheckInterval() {
    return healthCheckInterval;
  }

  public void setHealthCheckInterval(Duration healthCheckInterval) {
    this.healthCheckInterval = healthCheckInterval;
  }

  public Duration getReconnectDelay() {
    return reconnectDelay;
  }

  public void setReconnectDelay(Duration reconnectDelay) {
    this.reconnectDelay = reconnectDelay;
  }

  public int getRemoteWorkers() {
    return remoteWorkers;
  }

  public void setRemoteWorkers(int remoteWorkers) {
    this.remoteWorkers = remoteWorkers;
  }

  public int getRemoteQueueCapacity() {
    return remoteQueueCapacity;
  }

  public void setRemoteQueueCapacity(int remoteQueueCapacity) {
    this.remoteQueueCapacity = remoteQueueCapacity;
  }

  public Local getLocal() {
    return local;
  }

  public void setLocal(Local local) {
    this.local = local;
  }

  public Remote getRemote() {
    return remote;
  }

  public void setRemote(Remote remote) {
    this.remote = remote;
  }

  public Sync getSync() {
    return sync;
  }

  public void setSync(Sync sync) {
    this.sync = sync;
  }

  public Queue getQueue() {
    return queue;
  }

  public void setQueue(Queue queue) {
    this.queue = queue;
  }

  public Cache getCache() {
    return cache;
  }

  public void setCache(Cache cache) {
    this.cache = cache;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public void setMetrics(Metrics metrics) {
    this.metrics = metrics;
  }

  public static class Local {
    /** Path of the embedded database file, without the {@code .mv.db} suffix. */
    private String path = "data/local-backup";

    public String getPath() {
      return path;
    }

    public void setPath(String path) {
      this.path = path;
    }
  }

  public static class Remote {
    /** Use the application's DataSource as the remote store. */
    private boolean enabled = true;

    /** Cleanup sweep interval of the remote read caches. */
    private Duration cacheCleanupInterval = Duration.ofMinutes(5);

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public Duration getCacheCleanupInterval() {
      return cacheCleanupInterval;
    }

    public void setCacheCleanupInterval(Duration cacheCleanupInterval) {
      this.cacheCleanupInterval = cacheCleanupInterval;
    }
  }

  public static class Sync {
    /** Interval between queue drains while the remote store is in use. */
    private Duration interval = Duration.ofSeconds(60);

    /** Maximum queue items replayed per drain. */
    private int batchSize = 100;

    public Duration getInterval() {
      return interval;
    }

    public void setInterval(Duration interval) {
      this.interval = interval;
    }

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }
  }

  public static class Queue {
    /** Age after which queue items are purged. */
    private Duration retention = Duration.ofDays(7);

    /** Failed attempts after which a queue item is dead-lettered. */
    private int maxRetries = 5;

    /** Interval between purge runs. */
    private Duration purgeInterval = Duration.ofHours(1);

    public Duration getRetention() {
      return retention;
    }

    public void setRetention(Duration retention) {
      this.retention = retention;
    }

    public int getMaxRetries() {
      return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
    }

    public Duration getPurgeInterval() {
      return purgeInterval;
    }

    public void setPurgeInterval(Duration purgeInterval) {
      this.purgeInterval = purgeInterval;
    }
  }

  public static class Cache {
    private Family guildSettings = new Family(CacheSpec.GUILD_SETTINGS_DEFAULT);
    private Family userSettings = new Family(CacheSpec.USER_SETTINGS_DEFAULT);
    private Family economy = new Family(CacheSpec.ECONOMY_DEFAULT);
    private Family levels = new Family(CacheSpec.LEVELS_DEFAULT);

    public Family getGuildSettings() {
      return guildSettings;
    }

    public void setGuildSettings(Family guildSettings) {
      this.guildSettings = guildSettings;
    }

    public Family getUserSettings() {
      return userSettings;
    }

    public void setUserSettings(Family userSettings) {
      this.userSettings = userSettings;
    }

    public Family getEconomy() {
      return economy;
    }

    public void setEconomy(Family economy) {
      this.economy = economy;
    }

    public Family getLevels() {
      return levels;
    }

    public void setLevels(Family levels) {
      this.levels = levels;
    }
  }

  /**
   * TTL and capacity of one remote cache family.
   */
  public static class Family {
    private Duration ttl;
    private int maxSize;

    public Family() {
      this(CacheSpec.GUILD_SETTINGS_DEFAULT);
    }

    Family(CacheSpec defaults) {
      this.ttl = defaults.ttl();
      this.maxSize = defaults.maxSize();
    }

    public Duration getTtl() {
      return ttl;
    }

    public void setTtl(Duration ttl) {
      this.ttl = ttl;
    }

    public int getMaxSize() {
      return maxSize;
    }

    public void setMaxSize(int maxSize) {
      this.maxSize = maxSize;
    }

    CacheSpec toSpec() {
      return new CacheSpec(ttl, maxSize);
    }
  }

  public static class Metrics {
    /** Register a Micrometer exporter when a MeterRegistry is present. */
    private boolean enabled = true;

    /** Prefix of every meter name. */
    private String namePrefix = "dualstore";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
