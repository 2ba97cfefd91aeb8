package dualstore.manager;

import dualstore.StoreInitializationException;
import dualstore.dead.DeadLetterManager;
import dualstore.model.GuildSettings;
import dualstore.model.LevelProgress;
import dualstore.model.LevelRecord;
import dualstore.model.RemoteCacheStats;
import dualstore.model.StoreMode;
import dualstore.model.SyncOperation;
import dualstore.model.SyncTable;
import dualstore.model.UserSettings;
import dualstore.model.WithdrawResult;
import dualstore.purge.SyncQueuePurgeScheduler;
import dualstore.spi.LocalStore;
import dualstore.spi.MetricsExporter;
import dualstore.spi.RemoteStore;
import dualstore.sync.SyncItemApplier;
import dualstore.sync.SyncPayload;
import dualstore.sync.SyncWorker;
import dualstore.util.DaemonThreadFactory;
import dualstore.util.JsonCodec;
import dualstore.util.RemoteCallException;
import dualstore.util.TimeLimiter;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single entry point for reads and writes that must keep working while the remote store is
 * down.
 *
 * <p>The manager arbitrates between a durable {@link LocalStore} and an optional
 * {@link RemoteStore}. It moves between modes as follows:
 * <pre>
 *   UNKNOWN --force-offline / no remote--&gt; DISABLED   (terminal)
 *   UNKNOWN --initial probe ok-----------&gt; REMOTE
 *   UNKNOWN --initial probe fails--------&gt; LOCAL
 *   REMOTE  --periodic probe fails-------&gt; LOCAL
 *   LOCAL   --reconnect probe ok---------&gt; REMOTE     (queue drained at once)
 *   LOCAL   --reconnect probe fails------&gt; LOCAL      (reconnect rescheduled)
 * </pre>
 *
 * <p><b>Writes</b> always go to the local store first. The queue flag for that write is taken
 * from the mode before any remote call: outside {@code REMOTE} the mutation is queued in the
 * same local transaction. In {@code REMOTE} the mutation is then sent to the remote store under
 * the write timeout. Money and experience additions are sent without waiting; every other write
 * waits for the remote result. A failed or timed-out remote write is logged and, unless
 * disabled, queued for replay. A timed-out additive write may still have landed, so its replay
 * can count it twice.
 *
 * <p><b>Reads</b> in {@code REMOTE} go to the remote store under the read timeout and fall back
 * to the local copy on any failure. In every other mode they read the local copy only.
 *
 * <p>After a failed remote write the entity is <em>pending</em>: its remote cache entry is
 * invalidated, reads of it are served locally and later writes to it are queued instead of
 * sent, until a drain leaves no drainable queue item for it.
 *
 * <p>Local failures propagate to the caller. Remote failures never do.
 *
 * <p>Create instances via {@link #builder()}, then call {@link #start()}. This class is
 * thread-safe.
 */
public final class ResilientManager implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ResilientManager.class.getName());

  private final Supplier<? extends LocalStore> localStoreFactory;
  private final RemoteStore remote;
  private final boolean forceOffline;
  private final boolean queueFailedRemoteWrites;
  private final Duration initialHealthCheckTimeout;
  private final Duration healthCheckTimeout;
  private final Duration readTimeout;
  private final Duration writeTimeout;
  private final Duration healthCheckInterval;
  private final Duration reconnectDelay;
  private final Duration syncInterval;
  private final int syncBatchSize;
  private final Duration queueRetention;
  private final Duration queuePurgeInterval;
  private final int remoteWorkers;
  private final int remoteQueueCapacity;
  private final MetricsExporter metrics;

  private final PendingWrites pending = new PendingWrites(JsonCodec.getDefault());

  private volatile StoreMode mode = StoreMode.UNKNOWN;
  private volatile boolean available;
  private volatile LocalStore local;

  private volatile boolean closed;
  private ScheduledExecutorService scheduler;
  private ScheduledFuture<?> healthTask;
  private ScheduledFuture<?> reconnectTask;
  private TimeLimiter limiter;
  private SyncWorker syncWorker;
  private SyncQueuePurgeScheduler purgeScheduler;
  private DeadLetterManager deadLetterManager;

  private ResilientManager(Builder builder) {
    this.localStoreFactory = Objects.requireNonNull(builder.localStoreFactory, "localStore");
    this.remote = builder.remote;
    this.forceOffline = builder.forceOffline;
    this.queueFailedRemoteWrites = builder.queueFailedRemoteWrites;
    this.initialHealthCheckTimeout = positive(builder.initialHealthCheckTimeout,
        "initialHealthCheckTimeout");
    this.healthCheckTimeout = positive(builder.healthCheckTimeout, "healthCheckTimeout");
    this.readTimeout = positive(builder.readTimeout, "readTimeout");
    this.writeTimeout = positive(builder.writeTimeout, "writeTimeout");
    this.healthCheckInterval = positive(builder.healthCheckInterval, "healthCheckInterval");
    this.reconnectDelay = positive(builder.reconnectDelay, "reconnectDelay");
    this.syncInterval = positive(builder.syncInterval, "syncInterval");
    this.queueRetention = Objects.requireNonNull(builder.queueRetention, "queueRetention");
    this.queuePurgeInterval = positive(builder.queuePurgeInterval, "queuePurgeInterval");
    if (queueRetention.isNegative()) {
      throw new IllegalArgumentException("queueRetention must be >= 0");
    }
    if (builder.syncBatchSize <= 0) {
      throw new IllegalArgumentException("syncBatchSize must be > 0");
    }
    if (builder.remoteWorkers <= 0) {
      throw new IllegalArgumentException("remoteWorkers must be > 0");
    }
    if (builder.remoteQueueCapacity <= 0) {
      throw new IllegalArgumentException("remoteQueueCapacity must be > 0");
    }
    this.syncBatchSize = builder.syncBatchSize;
    this.remoteWorkers = builder.remoteWorkers;
    this.remoteQueueCapacity = builder.remoteQueueCapacity;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Opens the local store, probes the remote store and enters the initial mode.
   *
   * <p>The local store is opened before the remote store is touched; if it cannot be opened
   * the manager stays in {@link StoreMode#UNKNOWN} and nothing remote happens. Calling
   * {@code start()} again after a successful start returns the current mode.
   *
   * @return the mode entered
   * @throws StoreInitializationException if the local store cannot be opened
   */
  public synchronized StoreMode start() {
    if (closed) {
      throw new IllegalStateException("ResilientManager has been shut down");
    }
    if (local != null) {
      return mode;
    }
    logger.info("Starting resilient data manager");
    LocalStore opened = openLocalStore();

    scheduler = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("dualstore-manager-"));
    purgeScheduler = SyncQueuePurgeScheduler.builder()
        .localStore(opened)
        .retention(queueRetention)
        .interval(queuePurgeInterval)
        .metrics(metrics)
        .build();
    deadLetterManager = new DeadLetterManager(opened);
    local = opened;
    purgeScheduler.start();

    if (forceOffline || remote == null) {
      transition(StoreMode.DISABLED);
      available = true;
      logger.log(Level.INFO, "Remote store {0}; running on the local store only",
          forceOffline ? "disabled by configuration" : "not configured");
      return mode;
    }

    limiter = new TimeLimiter("dualstore-remote-", remoteWorkers, remoteQueueCapacity);
    syncWorker = SyncWorker.builder()
        .localStore(opened)
        .applier(new SyncItemApplier(remote))
        .batchSize(syncBatchSize)
        .interval(syncInterval)
        .metrics(metrics)
        .gate(() -> mode == StoreMode.REMOTE)
        .afterDrain(this::reloadPending)
        .build();

    if (probe(initialHealthCheckTimeout)) {
      enterRemote();
      logger.info("Remote store reachable; running in remote mode");
    } else {
      enterLocal();
      logger.log(Level.WARNING, "Remote store unreachable; running in local mode, "
          + "reconnect in {0}", reconnectDelay);
    }
    available = true;
    return mode;
  }

  private LocalStore openLocalStore() {
    try {
      return Objects.requireNonNull(localStoreFactory.get(), "localStore");
    } catch (StoreInitializationException e) {
      logger.log(Level.SEVERE, "Local store could not be opened", e);
      throw e;
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Local store could not be opened", e);
      throw new StoreInitializationException("Local store could not be opened", e);
    }
  }

  public StoreMode getMode() {
    return mode;
  }

  public boolean isAvailable() {
    return available;
  }

  // --- reads ---

  public String getGuildLang(String guildId) {
    Objects.requireNonNull(guildId, "guildId");
    return read("guild lang", SyncTable.GUILD_SETTINGS, guildId, () -> remote.getGuildLang(guildId),
        () -> local().getGuildLang(guildId));
  }

  public String getGuildPrefix(String guildId) {
    Objects.requireNonNull(guildId, "guildId");
    return read("guild prefix", SyncTable.GUILD_SETTINGS, guildId, () -> remote.getGuildPrefix(guildId),
        () -> local().getGuildPrefix(guildId));
  }

  /**
   * @return the welcome channel id, or {@code null} when none is configured
   */
  public String getWelcomeChannel(String guildId) {
    Objects.requireNonNull(guildId, "guildId");
    return read("welcome channel", SyncTable.GUILD_SETTINGS, guildId, () -> remote.getWelcomeChannel(guildId),
        () -> local().getWelcomeChannel(guildId));
  }

  public GuildSettings getGuildSettings(String guildId) {
    Objects.requireNonNull(guildId, "guildId");
    return read("guild settings", SyncTable.GUILD_SETTINGS, guildId, () -> remote.getGuildSettings(guildId),
        () -> local().getGuildSettings(guildId));
  }

  public UserSettings getUserSettings(String userId) {
    Objects.requireNonNull(userId, "userId");
    return read("user settings", SyncTable.USER_SETTINGS, userId, () -> remote.getUserSettings(userId),
        () -> local().getUserSettings(userId));
  }

  public long getBalance(String userId) {
    Objects.requireNonNull(userId, "userId");
    return read("balance", SyncTable.ECONOMY, userId, () -> remote.getBalance(userId),
        () -> local().getBalance(userId));
  }

  public LevelRecord getLevel(String userId) {
    Objects.requireNonNull(userId, "userId");
    return read("level", SyncTable.LEVELS, userId, () -> remote.getLevel(userId),
        () -> local().getLevel(userId));
  }

  private <T> T read(String what, SyncTable table, String id, Callable<T> remoteRead,
      Supplier<T> localRead) {
    local();
    if (mode == StoreMode.REMOTE && !pending.contains(table, id)) {
      try {
        return limiter.call(remoteRead, readTimeout);
      } catch (RemoteCallException e) {
        metrics.incrementRemoteReadFallback();
        logger.log(Level.FINE, "Remote read of " + what + " failed, using local copy", e);
      } catch (RuntimeException e) {
        // raised outside the remote call itself
        metrics.incrementRemoteReadFallback();
        logger.log(Level.FINE, "Remote read of " + what + " unavailable, using local copy", e);
      }
    }
    return localRead.get();
  }

  // --- writes ---

  public void setGuildLang(String guildId, String lang) {
    Objects.requireNonNull(guildId, "guildId");
    Objects.requireNonNull(lang, "lang");
    boolean direct = writesDirectly(SyncTable.GUILD_SETTINGS, guildId);
    local().setGuildLang(guildId, lang, !direct);
    if (direct) {
      writeRemote(SyncTable.GUILD_SETTINGS, guildId, SyncOperation.UPDATE,
          SyncPayload.guildLang(guildId, lang),
          () -> {
            remote.setGuildLang(guildId, lang);
            return null;
          });
    }
  }

  public void setGuildPrefix(String guildId, String prefix) {
    Objects.requireNonNull(guildId, "guildId");
    Objects.requireNonNull(prefix, "prefix");
    boolean direct = writesDirectly(SyncTable.GUILD_SETTINGS, guildId);
    local().setGuildPrefix(guildId, prefix, !direct);
    if (direct) {
      writeRemote(SyncTable.GUILD_SETTINGS, guildId, SyncOperation.UPDATE,
          SyncPayload.guildPrefix(guildId, prefix),
          () -> {
            remote.setGuildPrefix(guildId, prefix);
            return null;
          });
    }
  }

  /**
   * @param channelId channel id, or {@code null} to clear the welcome channel
   */
  public void setWelcomeChannel(String guildId, String channelId) {
    Objects.requireNonNull(guildId, "guildId");
    boolean direct = writesDirectly(SyncTable.GUILD_SETTINGS, guildId);
    local().setWelcomeChannel(guildId, channelId, !direct);
    if (direct) {
      writeRemote(SyncTable.GUILD_SETTINGS, guildId, SyncOperation.UPDATE,
          SyncPayload.welcomeChannel(guildId, channelId),
          () -> {
            remote.setWelcomeChannel(guildId, channelId);
            return null;
          });
    }
  }

  public void setUserSettings(UserSettings settings) {
    Objects.requireNonNull(settings, "settings");
    boolean direct = writesDirectly(SyncTable.USER_SETTINGS, settings.userId());
    local().setUserSettings(settings, !direct);
    if (direct) {
      writeRemote(SyncTable.USER_SETTINGS, settings.userId(), SyncOperation.UPDATE,
          SyncPayload.userSettings(settings),
          () -> {
            remote.setUserSettings(settings);
            return null;
          });
    }
  }

  /**
   * Adds money to a balance. In remote mode the remote addition is sent without waiting.
   *
   * @return the local balance after the addition
   */
  public long addMoney(String userId, long amount) {
    Objects.requireNonNull(userId, "userId");
    requireNonNegative(amount);
    boolean direct = writesDirectly(SyncTable.ECONOMY, userId);
    long balance = local().addMoney(userId, amount, !direct);
    if (direct) {
      writeRemoteDetached(SyncTable.ECONOMY, userId, SyncOperation.ADD,
          SyncPayload.amount(userId, amount), () -> remote.addMoney(userId, amount));
    }
    return balance;
  }

  /**
   * Withdraws money if the local balance covers it. In remote mode a successful local
   * withdrawal is also applied remotely, and the call waits for it.
   */
  public WithdrawResult removeMoney(String userId, long amount) {
    Objects.requireNonNull(userId, "userId");
    requireNonNegative(amount);
    boolean direct = writesDirectly(SyncTable.ECONOMY, userId);
    WithdrawResult result = local().removeMoney(userId, amount, !direct);
    if (direct && result.success()) {
      writeRemote(SyncTable.ECONOMY, userId, SyncOperation.REMOVE,
          SyncPayload.amount(userId, amount),
          () -> {
            WithdrawResult remoteResult = remote.removeMoney(userId, amount);
            if (!remoteResult.success()) {
              logger.log(Level.WARNING, "Remote balance of {0} did not cover a withdrawal of {1}"
                  + " that the local balance covered", new Object[]{userId, amount});
            }
            return remoteResult;
          });
    }
    return result;
  }

  /**
   * Adds experience. In remote mode the remote addition is sent without waiting.
   *
   * @return the local level progress after the addition
   */
  public LevelProgress addXP(String userId, long amount) {
    Objects.requireNonNull(userId, "userId");
    requireNonNegative(amount);
    boolean direct = writesDirectly(SyncTable.LEVELS, userId);
    LevelProgress progress = local().addXP(userId, amount, !direct);
    if (direct) {
      writeRemoteDetached(SyncTable.LEVELS, userId, SyncOperation.ADD_XP,
          SyncPayload.amount(userId, amount), () -> remote.addXP(userId, amount));
    }
    return progress;
  }

  /**
   * Whether a write to this entity goes straight to the remote store. An entity with
   * unconfirmed changes is written through the queue so the replay keeps the write order.
   */
  private boolean writesDirectly(SyncTable table, String id) {
    return mode == StoreMode.REMOTE && !pending.contains(table, id);
  }

  private void writeRemote(SyncTable table, String id, SyncOperation operation,
      Map<String, String> payload, Callable<?> remoteWrite) {
    try {
      limiter.call(remoteWrite, writeTimeout);
    } catch (RuntimeException e) {
      onRemoteWriteFailed(table, id, operation, payload, e);
    }
  }

  private void writeRemoteDetached(SyncTable table, String id, SyncOperation operation,
      Map<String, String> payload, Callable<?> remoteWrite) {
    try {
      limiter.callAsync(remoteWrite, writeTimeout).whenComplete((value, error) -> {
        if (error != null) {
          onRemoteWriteFailed(table, id, operation, payload, error);
        }
      });
    } catch (RuntimeException e) {
      onRemoteWriteFailed(table, id, operation, payload, e);
    }
  }

  // The local copy now holds the newest value: reads of the entity stay local until a drain
  // finds no drainable item left for it.
  private void onRemoteWriteFailed(SyncTable table, String id, SyncOperation operation,
      Map<String, String> payload, Throwable error) {
    metrics.incrementRemoteWriteFailure();
    logger.log(Level.WARNING, "Remote write " + table.tableName() + "/" + operation
        + " failed" + (queueFailedRemoteWrites ? ", queued for replay" : ""), error);
    if (queueFailedRemoteWrites) {
      try {
        local().enqueue(table, operation, payload);
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Failed to queue remote write " + table.tableName()
            + "/" + operation, e);
      }
    }
    pending.mark(table, id);
    try {
      if (table == SyncTable.GUILD_SETTINGS) {
        remote.invalidateGuildCache(id);
      } else {
        remote.invalidateUserCache(id);
      }
    } catch (RuntimeException e) {
      logger.log(Level.FINE, "Remote cache invalidation failed", e);
    }
  }

  private void reloadPending() {
    LocalStore store = local;
    if (store == null) {
      return;
    }
    try {
      pending.reload(store);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to read pending entities from the sync queue", e);
    }
  }

  // --- sync and health ---

  /**
   * Runs one drain cycle of the sync queue. Does nothing outside remote mode.
   *
   * @return counts for this cycle
   */
  public SyncWorker.DrainResult syncToRemote() {
    SyncWorker worker = syncWorker;
    if (mode != StoreMode.REMOTE || worker == null) {
      return SyncWorker.DrainResult.EMPTY;
    }
    return worker.drain();
  }

  /**
   * Probes the remote store. In remote mode a failed probe switches to local mode and schedules
   * a reconnect.
   *
   * @return whether the remote store answered in time
   */
  public boolean checkRemoteHealth() {
    if (remote == null || mode == StoreMode.DISABLED || mode == StoreMode.UNKNOWN) {
      return false;
    }
    boolean healthy = probe(healthCheckTimeout);
    if (!healthy) {
      synchronized (this) {
        if (mode == StoreMode.REMOTE && !closed) {
          logger.warning("Remote store health check failed; switching to local mode");
          enterLocal();
        }
      }
    }
    return healthy;
  }

  /**
   * Tries to get back to remote mode. On success the sync queue is drained at once; on failure
   * another attempt is scheduled after the reconnect delay.
   *
   * @return {@code true} if the manager is in remote mode afterwards
   */
  public boolean attemptReconnect() {
    if (mode != StoreMode.LOCAL) {
      return mode == StoreMode.REMOTE;
    }
    logger.info("Attempting to reconnect to the remote store");
    boolean healthy = probe(initialHealthCheckTimeout);
    synchronized (this) {
      if (closed || mode != StoreMode.LOCAL) {
        return mode == StoreMode.REMOTE;
      }
      if (!healthy) {
        scheduleReconnect();
        logger.log(Level.INFO, "Reconnect failed; next attempt in {0}", reconnectDelay);
        return false;
      }
      enterRemote();
      logger.info("Reconnected to the remote store; draining the sync queue");
    }
    try {
      syncToRemote();
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Sync after reconnect failed", e);
    }
    return true;
  }

  private boolean probe(Duration timeout) {
    try {
      return remote.checkHealth(timeout);
    } catch (RuntimeException e) {
      logger.log(Level.FINE, "Remote health probe threw", e);
      return false;
    }
  }

  // Transitions. Callers hold the monitor.

  private void enterRemote() {
    cancel(reconnectTask);
    reconnectTask = null;
    reloadPending();
    transition(StoreMode.REMOTE);
    syncWorker.start();
    long periodMs = healthCheckInterval.toMillis();
    healthTask = scheduler.scheduleWithFixedDelay(
        this::runHealthCheck, periodMs, periodMs, TimeUnit.MILLISECONDS);
  }

  private void enterLocal() {
    cancel(healthTask);
    healthTask = null;
    syncWorker.stop();
    transition(StoreMode.LOCAL);
    scheduleReconnect();
  }

  private void scheduleReconnect() {
    cancel(reconnectTask);
    reconnectTask = scheduler.schedule(
        this::runReconnect, reconnectDelay.toMillis(), TimeUnit.MILLISECONDS);
  }

  private void transition(StoreMode to) {
    StoreMode from = mode;
    mode = to;
    if (from != to) {
      logger.log(Level.INFO, "Mode {0} -> {1}", new Object[]{from.label(), to.label()});
      metrics.recordModeTransition(from, to);
    }
  }

  private void runHealthCheck() {
    try {
      checkRemoteHealth();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Health check failed", t);
    }
  }

  private void runReconnect() {
    try {
      attemptReconnect();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Reconnect attempt failed", t);
    }
  }

  private static void cancel(ScheduledFuture<?> task) {
    if (task != null) {
      task.cancel(false);
    }
  }

  // --- stats, dead letters, lifecycle ---

  public ManagerStats getStats() {
    StoreMode current = mode;
    RemoteCacheStats cacheStats = null;
    if (current == StoreMode.REMOTE) {
      try {
        cacheStats = remote.cacheStats();
      } catch (RuntimeException e) {
        logger.log(Level.FINE, "Remote cache stats unavailable", e);
      }
    }
    int queueSize = -1;
    LocalStore store = local;
    if (store != null) {
      try {
        queueSize = store.countSyncQueue();
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Failed to count the sync queue", e);
      }
    }
    return new ManagerStats(current, available, cacheStats, queueSize);
  }

  /**
   * Facade over queue items that ran out of retries.
   *
   * @throws IllegalStateException if the manager has not been started
   */
  public DeadLetterManager deadLetters() {
    local();
    return deadLetterManager;
  }

  /**
   * Stops every timer, drains the queue once more if the remote store is up, then closes
   * both stores. Idempotent.
   */
  public synchronized void shutdown() {
    if (closed) {
      return;
    }
    closed = true;
    logger.info("Shutting down resilient data manager");
    if (scheduler != null) {
      cancel(healthTask);
      cancel(reconnectTask);
      scheduler.shutdownNow();
    }
    if (purgeScheduler != null) {
      purgeScheduler.close();
    }
    if (syncWorker != null) {
      syncWorker.stop();
      if (mode == StoreMode.REMOTE) {
        try {
          syncWorker.drain();
        } catch (RuntimeException e) {
          logger.log(Level.SEVERE, "Final sync before shutdown failed", e);
        }
      }
      syncWorker.close();
    }
    if (limiter != null) {
      limiter.close(writeTimeout);
    }
    available = false;
    LocalStore store = local;
    if (store != null) {
      try {
        store.close();
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Failed to close the local store", e);
      }
    }
    if (remote != null) {
      try {
        remote.close();
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Failed to close the remote store", e);
      }
    }
    logger.info("Resilient data manager stopped");
  }

  @Override
  public void close() {
    shutdown();
  }

  private LocalStore local() {
    if (closed) {
      throw new IllegalStateException("ResilientManager has been shut down");
    }
    LocalStore store = local;
    if (store == null) {
      throw new IllegalStateException("ResilientManager has not been started");
    }
    return store;
  }

  private static void requireNonNegative(long amount) {
    if (amount < 0) {
      throw new IllegalArgumentException("amount must be >= 0");
    }
  }

  private static Duration positive(Duration value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isNegative() || value.isZero()) {
      throw new IllegalArgumentException(name + " must be > 0");
    }
    return value;
  }

  /**
   * Builder for {@link ResilientManager}.
   */
  public static final class Builder {
    private Supplier<? extends LocalStore> localStoreFactory;
    private RemoteStore remote;
    private boolean forceOffline;
    private boolean queueFailedRemoteWrites = true;
    private Duration initialHealthCheckTimeout = Duration.ofMillis(3000);
    private Duration healthCheckTimeout = Duration.ofMillis(2000);
    private Duration readTimeout = Duration.ofMillis(800);
    private Duration writeTimeout = Duration.ofMillis(1000);
    private Duration healthCheckInterval = Duration.ofSeconds(30);
    private Duration reconnectDelay = Duration.ofMinutes(5);
    private Duration syncInterval = Duration.ofSeconds(60);
    private int syncBatchSize = 100;
    private Duration queueRetention = Duration.ofDays(7);
    private Duration queuePurgeInterval = Duration.ofHours(1);
    private int remoteWorkers = 4;
    private int remoteQueueCapacity = TimeLimiter.DEFAULT_QUEUE_CAPACITY;
    private MetricsExporter metrics;

    private Builder() {
    }

    /**
     * Sets an already opened local store.
     *
     * <p><b>Required</b> (this or {@link #localStore(Supplier)}).
     */
    public Builder localStore(LocalStore localStore) {
      Objects.requireNonNull(localStore, "localStore");
      this.localStoreFactory = () -> localStore;
      return this;
    }

    /**
     * Sets a factory that opens the local store during {@link ResilientManager#start()}, before
     * the remote store is contacted.
     *
     * <p><b>Required</b> (this or {@link #localStore(LocalStore)}).
     */
    public Builder localStore(Supplier<? extends LocalStore> localStoreFactory) {
      this.localStoreFactory = localStoreFactory;
      return this;
    }

    /**
     * Sets the remote store.
     *
     * <p>Optional. Without one the manager runs in {@link StoreMode#DISABLED}.
     */
    public Builder remoteStore(RemoteStore remote) {
      this.remote = remote;
      return this;
    }

    /**
     * Skips the remote store entirely.
     *
     * <p>Optional. Defaults to {@code false}.
     */
    public Builder forceOffline(boolean forceOffline) {
      this.forceOffline = forceOffline;
      return this;
    }

    /**
     * Whether a remote write that fails in remote mode is queued for replay.
     *
     * <p>Optional. Defaults to {@code true}.
     */
    public Builder queueFailedRemoteWrites(boolean queueFailedRemoteWrites) {
      this.queueFailedRemoteWrites = queueFailedRemoteWrites;
      return this;
    }

    /**
     * Probe timeout used by {@code start()} and reconnect attempts.
     *
     * <p>Optional. Defaults to 3000 ms.
     */
    public Builder initialHealthCheckTimeout(Duration timeout) {
      this.initialHealthCheckTimeout = timeout;
      return this;
    }

    /**
     * Probe timeout used by the periodic health check in remote mode.
     *
     * <p>Optional. Defaults to 2000 ms.
     */
    public Builder healthCheckTimeout(Duration timeout) {
      this.healthCheckTimeout = timeout;
      return this;
    }

    /**
     * Optional. Defaults to 800 ms.
     */
    public Builder readTimeout(Duration timeout) {
      this.readTimeout = timeout;
      return this;
    }

    /**
     * Optional. Defaults to 1000 ms.
     */
    public Builder writeTimeout(Duration timeout) {
      this.writeTimeout = timeout;
      return this;
    }

    /**
     * Optional. Defaults to 30 seconds.
     */
    public Builder healthCheckInterval(Duration interval) {
      this.healthCheckInterval = interval;
      return this;
    }

    /**
     * Delay before each reconnect attempt in local mode.
     *
     * <p>Optional. Defaults to 5 minutes.
     */
    public Builder reconnectDelay(Duration delay) {
      this.reconnectDelay = delay;
      return this;
    }

    /**
     * Optional. Defaults to 60 seconds.
     */
    public Builder syncInterval(Duration interval) {
      this.syncInterval = interval;
      return this;
    }

    /**
     * Maximum queue items replayed per drain cycle.
     *
     * <p>Optional. Defaults to {@code 100}.
     */
    public Builder syncBatchSize(int batchSize) {
      this.syncBatchSize = batchSize;
      return this;
    }

    /**
     * Age after which queue items are purged whether or not they were applied.
     *
     * <p>Optional. Defaults to 7 days.
     */
    public Builder queueRetention(Duration retention) {
      this.queueRetention = retention;
      return this;
    }

    /**
     * Optional. Defaults to 1 hour.
     */
    public Builder queuePurgeInterval(Duration interval) {
      this.queuePurgeInterval = interval;
      return this;
    }

    /**
     * Threads available for deadline-bounded remote calls.
     *
     * <p>Optional. Defaults to {@code 4}.
     */
    public Builder remoteWorkers(int remoteWorkers) {
      this.remoteWorkers = remoteWorkers;
      return this;
    }

    /**
     * Remote calls allowed to wait for a free worker. Once that many are waiting, further
     * reads are served locally and further writes take the failed-write path without waiting
     * for their deadline.
     *
     * <p>Optional. Defaults to {@code 64}.
     */
    public Builder remoteQueueCapacity(int remoteQueueCapacity) {
      this.remoteQueueCapacity = remoteQueueCapacity;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Builds the manager. Call {@link ResilientManager#start()} before use.
     *
     * @throws NullPointerException     if no local store was given
     * @throws IllegalArgumentException if a duration or size is not positive
     */
    public ResilientManager build() {
      return new ResilientManager(this);
    }
  }
}
