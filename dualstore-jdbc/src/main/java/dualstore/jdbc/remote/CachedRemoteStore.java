package dualstore.jdbc.remote;

import dualstore.cache.BoundedCache;
import dualstore.cache.CacheStats;
import dualstore.jdbc.JdbcStoreException;
import dualstore.jdbc.JdbcTemplate;
import dualstore.jdbc.RemoteStoreException;
import dualstore.jdbc.dialect.Dialects;
import dualstore.jdbc.spi.Dialect;
import dualstore.model.GuildSettings;
import dualstore.model.LevelProgress;
import dualstore.model.LevelRecord;
import dualstore.model.RemoteCacheStats;
import dualstore.model.UserSettings;
import dualstore.model.WithdrawResult;
import dualstore.spi.MetricsExporter;
import dualstore.spi.RemoteStore;
import dualstore.util.DaemonThreadFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link RemoteStore} over a JDBC {@link DataSource}, fronted by one {@link BoundedCache} per
 * entity family.
 *
 * <p>Reads check the family cache first and populate it on a miss. Writes go to the database
 * first; on success every cache key derived from the written row is either replaced with the
 * new value or deleted. A failed write leaves the caches untouched and throws
 * {@link RemoteStoreException}.
 *
 * <p>The dialect is detected from the first connection unless one is configured, so building
 * the store never requires the database to be reachable.
 */
public final class CachedRemoteStore implements RemoteStore {
  private static final Logger logger = Logger.getLogger(CachedRemoteStore.class.getName());

  public static final String GUILD_SETTINGS = "guildSettings";
  public static final String USER_SETTINGS = "userSettings";
  public static final String ECONOMY = "economy";
  public static final String LEVELS = "levels";

  private final DataSource dataSource;
  private final boolean ownsDataSource;
  private final Clock clock;
  private final MetricsExporter metrics;
  private volatile Dialect dialect;

  // guild values are String, GuildSettings or Optional<String> depending on the key prefix
  private final BoundedCache<Object> guildCache;
  private final BoundedCache<UserSettings> userCache;
  private final BoundedCache<Long> economyCache;
  private final BoundedCache<LevelRecord> levelCache;

  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();
  private final ExecutorService probeExecutor;

  private CachedRemoteStore(Builder builder) {
    this.dataSource = Objects.requireNonNull(builder.dataSource, "dataSource");
    this.clock = Objects.requireNonNull(builder.clock, "clock");
    this.metrics = Objects.requireNonNull(builder.metrics, "metrics");
    Objects.requireNonNull(builder.cleanupInterval, "cacheCleanupInterval");
    this.ownsDataSource = builder.ownsDataSource;
    this.dialect = builder.dialect;

    this.guildCache = newCache(GUILD_SETTINGS, builder.guildSettings, builder);
    this.userCache = newCache(USER_SETTINGS, builder.userSettings, builder);
    this.economyCache = newCache(ECONOMY, builder.economy, builder);
    this.levelCache = newCache(LEVELS, builder.levels, builder);
    this.probeExecutor = Executors.newSingleThreadExecutor(
        new DaemonThreadFactory("dualstore-probe-"));
  }

  private static <V> BoundedCache<V> newCache(String family, CacheSpec spec, Builder builder) {
    Objects.requireNonNull(spec, family);
    BoundedCache<V> cache = BoundedCache.builder(family)
        .ttl(spec.ttl())
        .maxSize(spec.maxSize())
        .cleanupInterval(builder.cleanupInterval)
        .clock(builder.clock)
        .build();
    cache.start();
    return cache;
  }

  public static Builder builder() {
    return new Builder();
  }

  // ── reads ─────────────────────────────────────────────────────

  @Override
  public String getGuildLang(String guildId) {
    return (String) readThrough(GUILD_SETTINGS, guildCache, "lang:" + guildId,
        () -> loadGuild(guildId).lang());
  }

  @Override
  public String getGuildPrefix(String guildId) {
    return (String) readThrough(GUILD_SETTINGS, guildCache, "prefix:" + guildId,
        () -> loadGuild(guildId).prefix());
  }

  @Override
  @SuppressWarnings("unchecked")
  public String getWelcomeChannel(String guildId) {
    Optional<String> channel = (Optional<String>) readThrough(GUILD_SETTINGS, guildCache,
        "welcome:" + guildId, () -> Optional.ofNullable(loadGuild(guildId).welcomeChannelId()));
    return channel.orElse(null);
  }

  @Override
  public GuildSettings getGuildSettings(String guildId) {
    return (GuildSettings) readThrough(GUILD_SETTINGS, guildCache, "settings:" + guildId,
        () -> loadGuild(guildId));
  }

  @Override
  public UserSettings getUserSettings(String userId) {
    return readThrough(USER_SETTINGS, userCache, "user:" + userId,
        () -> withConnection("read user settings", conn -> JdbcTemplate.queryOne(conn,
                "SELECT user_id, dm_notifications, level_up_messages, timezone, updated_at"
                    + " FROM user_settings WHERE user_id = ?",
                CachedRemoteStore::mapUser, userId)
            .orElseGet(() -> UserSettings.defaults(userId))));
  }

  @Override
  public long getBalance(String userId) {
    return readThrough(ECONOMY, economyCache, "balance:" + userId,
        () -> withConnection("read balance", conn -> selectBalance(conn, userId)));
  }

  @Override
  public LevelRecord getLevel(String userId) {
    return readThrough(LEVELS, levelCache, "xp:" + userId,
        () -> withConnection("read level", conn -> selectLevel(conn, userId)));
  }

  // ── writes ────────────────────────────────────────────────────

  @Override
  public void setGuildLang(String guildId, String lang) {
    Objects.requireNonNull(lang, "lang");
    inTransaction("set guild lang", conn -> upsert(conn, "guild_settings", "guild_id",
        List.of("lang", "updated_at"), guildId, lang, now()));
    guildCache.set("lang:" + guildId, lang);
    guildCache.delete("settings:" + guildId);
  }

  @Override
  public void setGuildPrefix(String guildId, String prefix) {
    Objects.requireNonNull(prefix, "prefix");
    inTransaction("set guild prefix", conn -> upsert(conn, "guild_settings", "guild_id",
        List.of("prefix", "updated_at"), guildId, prefix, now()));
    guildCache.set("prefix:" + guildId, prefix);
    guildCache.delete("settings:" + guildId);
  }

  @Override
  public void setWelcomeChannel(String guildId, String channelId) {
    inTransaction("set welcome channel", conn -> upsert(conn, "guild_settings", "guild_id",
        List.of("welcome_channel_id", "updated_at"), guildId, channelId, now()));
    guildCache.set("welcome:" + guildId, Optional.ofNullable(channelId));
    guildCache.delete("settings:" + guildId);
  }

  @Override
  public void setUserSettings(UserSettings settings) {
    Objects.requireNonNull(settings, "settings");
    Timestamp now = now();
    inTransaction("set user settings", conn -> upsert(conn, "user_settings", "user_id",
        List.of("dm_notifications", "level_up_messages", "timezone", "updated_at"),
        settings.userId(), settings.dmNotifications(), settings.levelUpMessages(),
        settings.timezone(), now));
    userCache.set("user:" + settings.userId(), settings.withUpdatedAt(now.toInstant()));
  }

  @Override
  public long addMoney(String userId, long amount) {
    long balance = inTransaction("add money", conn -> dialect(conn).incrementAndGet(
        conn, "economy", "user_id", "balance", userId, amount, now()));
    economyCache.set("balance:" + userId, balance);
    return balance;
  }

  @Override
  public WithdrawResult removeMoney(String userId, long amount) {
    WithdrawResult result = inTransaction("remove money", conn -> {
      int updated = JdbcTemplate.update(conn,
          "UPDATE economy SET balance = balance - ?, updated_at = ?"
              + " WHERE user_id = ? AND balance >= ?",
          amount, now(), userId, amount);
      return new WithdrawResult(updated == 1, selectBalance(conn, userId));
    });
    economyCache.set("balance:" + userId, result.balance());
    return result;
  }

  @Override
  public LevelProgress addXP(String userId, long amount) {
    LevelProgress progress = inTransaction("add xp", conn -> {
      long xp = dialect(conn).incrementAndGet(conn, "levels", "user_id", "xp",
          userId, amount, now());
      int stored = selectLevel(conn, userId).level();
      int computed = LevelRecord.levelForXp(xp);
      if (computed > stored) {
        JdbcTemplate.update(conn, "UPDATE levels SET level = ? WHERE user_id = ?",
            computed, userId);
      }
      return new LevelProgress(computed > stored, xp, Math.max(computed, stored));
    });
    levelCache.set("xp:" + userId,
        new LevelRecord(userId, progress.xp(), progress.level(), clock.instant()));
    return progress;
  }

  // ── health and caches ─────────────────────────────────────────

  /**
   * Runs the dialect's probe query on a daemon thread and waits at most {@code timeout}.
   * Never throws; failures are logged at FINE with their {@link ProbeFailure} kind.
   */
  @Override
  public boolean checkHealth(Duration timeout) {
    Future<Boolean> probe;
    try {
      probe = probeExecutor.submit(() -> probe(timeout));
    } catch (RuntimeException e) {
      logger.log(Level.FINE, "Health probe rejected", e);
      return false;
    }
    try {
      return probe.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      probe.cancel(true);
      logProbeFailure(e);
      return false;
    } catch (ExecutionException e) {
      logProbeFailure(e.getCause());
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      probe.cancel(true);
      return false;
    }
  }

  private boolean probe(Duration timeout) throws SQLException {
    try (Connection conn = dataSource.getConnection();
         Statement st = conn.createStatement()) {
      st.setQueryTimeout((int) Math.max(1, (timeout.toMillis() + 999) / 1000));
      st.execute(dialect(conn).probeSql());
      return true;
    }
  }

  private static void logProbeFailure(Throwable error) {
    if (logger.isLoggable(Level.FINE)) {
      logger.log(Level.FINE, "Remote health probe failed ({0}): {1}",
          new Object[]{ProbeFailure.classify(error), String.valueOf(error)});
    }
  }

  @Override
  public RemoteCacheStats cacheStats() {
    Map<String, CacheStats> caches = new LinkedHashMap<>();
    caches.put(GUILD_SETTINGS, guildCache.stats());
    caches.put(USER_SETTINGS, userCache.stats());
    caches.put(ECONOMY, economyCache.stats());
    caches.put(LEVELS, levelCache.stats());
    return RemoteCacheStats.of(hits.get(), misses.get(), caches);
  }

  @Override
  public void invalidateGuildCache(String guildId) {
    guildCache.delete("lang:" + guildId);
    guildCache.delete("prefix:" + guildId);
    guildCache.delete("welcome:" + guildId);
    guildCache.delete("settings:" + guildId);
  }

  @Override
  public void invalidateUserCache(String userId) {
    userCache.delete("user:" + userId);
    economyCache.delete("balance:" + userId);
    levelCache.delete("xp:" + userId);
  }

  /**
   * Destroys every cache and stops the probe thread. The data source is left open.
   */
  public void destroy() {
    guildCache.destroy();
    userCache.destroy();
    economyCache.destroy();
    levelCache.destroy();
    probeExecutor.shutdownNow();
  }

  /**
   * {@link #destroy()} plus closing the data source when this store owns it and it is
   * closeable (HikariCP, H2 pools).
   */
  @Override
  public void close() {
    destroy();
    if (ownsDataSource && dataSource instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        logger.log(Level.WARNING, "Failed to close remote data source", e);
      }
    }
    logger.info("Remote store closed");
  }

  // ── internals ─────────────────────────────────────────────────

  private <V> V readThrough(String family, BoundedCache<V> cache, String key, Supplier<V> loader) {
    V cached = cache.get(key);
    if (cached != null) {
      hits.incrementAndGet();
      metrics.incrementCacheHit(family);
      return cached;
    }
    misses.incrementAndGet();
    metrics.incrementCacheMiss(family);
    V loaded = loader.get();
    cache.set(key, loaded);
    return loaded;
  }

  private GuildSettings loadGuild(String guildId) {
    return withConnection("read guild settings", conn -> JdbcTemplate.queryOne(conn,
            "SELECT guild_id, lang, prefix, welcome_channel_id, updated_at"
                + " FROM guild_settings WHERE guild_id = ?",
            rs -> new GuildSettings(rs.getString(1), rs.getString(2), rs.getString(3),
                rs.getString(4), toInstant(rs.getTimestamp(5))),
            guildId)
        .orElseGet(() -> GuildSettings.defaults(guildId)));
  }

  private Dialect dialect(Connection conn) throws SQLException {
    Dialect d = dialect;
    if (d == null) {
      d = Dialects.detect(conn);
      dialect = d;
      logger.log(Level.INFO, "Remote store dialect detected: {0}", d.name());
    }
    return d;
  }

  @FunctionalInterface
  private interface SqlWork<T> {
    T run(Connection conn) throws SQLException;
  }

  private <T> T withConnection(String what, SqlWork<T> work) {
    try (Connection conn = dataSource.getConnection()) {
      return work.run(conn);
    } catch (SQLException | JdbcStoreException e) {
      throw new RemoteStoreException("Remote store failed to " + what, e);
    }
  }

  private <T> T inTransaction(String what, SqlWork<T> work) {
    try (Connection conn = dataSource.getConnection()) {
      boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      try {
        T result = work.run(conn);
        conn.commit();
        return result;
      } catch (SQLException | RuntimeException e) {
        try {
          conn.rollback();
        } catch (SQLException rollbackError) {
          e.addSuppressed(rollbackError);
        }
        throw e;
      } finally {
        conn.setAutoCommit(autoCommit);
      }
    } catch (SQLException | JdbcStoreException e) {
      throw new RemoteStoreException("Remote store failed to " + what, e);
    }
  }

  private int upsert(Connection conn, String table, String keyColumn, List<String> columns,
      Object... params) throws SQLException {
    return JdbcTemplate.update(conn, dialect(conn).upsertSql(table, keyColumn, columns), params);
  }

  private static long selectBalance(Connection conn, String userId) {
    return JdbcTemplate.queryOne(conn, "SELECT balance FROM economy WHERE user_id = ?",
        rs -> rs.getLong(1), userId).orElse(0L);
  }

  private static LevelRecord selectLevel(Connection conn, String userId) {
    return JdbcTemplate.queryOne(conn,
            "SELECT user_id, xp, level, updated_at FROM levels WHERE user_id = ?",
            rs -> new LevelRecord(rs.getString(1), rs.getLong(2), rs.getInt(3),
                toInstant(rs.getTimestamp(4))),
            userId)
        .orElseGet(() -> LevelRecord.empty(userId));
  }

  private static UserSettings mapUser(ResultSet rs) throws SQLException {
    return new UserSettings(rs.getString(1), rs.getBoolean(2), rs.getBoolean(3),
        rs.getString(4), toInstant(rs.getTimestamp(5)));
  }

  private Timestamp now() {
    return Timestamp.from(clock.instant());
  }

  private static Instant toInstant(Timestamp ts) {
    return ts == null ? null : ts.toInstant();
  }

  /**
   * Builder for {@link CachedRemoteStore}.
   */
  public static final class Builder {
    private DataSource dataSource;
    private Dialect dialect;
    private boolean ownsDataSource = true;
    private CacheSpec guildSettings = CacheSpec.GUILD_SETTINGS_DEFAULT;
    private CacheSpec userSettings = CacheSpec.USER_SETTINGS_DEFAULT;
    private CacheSpec economy = CacheSpec.ECONOMY_DEFAULT;
    private CacheSpec levels = CacheSpec.LEVELS_DEFAULT;
    private Duration cleanupInterval = Duration.ofMinutes(5);
    private MetricsExporter metrics = MetricsExporter.NOOP;
    private Clock clock = Clock.systemUTC();

    private Builder() {
    }

    /**
     * Sets the remote data source, typically a HikariCP pool.
     *
     * <p><b>Required.</b>
     */
    public Builder dataSource(DataSource dataSource) {
      this.dataSource = dataSource;
      return this;
    }

    /**
     * Sets the SQL dialect.
     *
     * <p>Optional. Detected from the first connection's URL when unset.
     */
    public Builder dialect(Dialect dialect) {
      this.dialect = dialect;
      return this;
    }

    /**
     * Whether {@link CachedRemoteStore#close()} also closes the data source.
     *
     * <p>Optional. Defaults to {@code true}. Set to {@code false} when the data source is
     * managed elsewhere, e.g. by a Spring context.
     */
    public Builder ownsDataSource(boolean ownsDataSource) {
      this.ownsDataSource = ownsDataSource;
      return this;
    }

    /** Optional. Defaults to 30 minutes / 500 entries. */
    public Builder guildSettingsCache(CacheSpec spec) {
      this.guildSettings = spec;
      return this;
    }

    /** Optional. Defaults to 30 minutes / 1000 entries. */
    public Builder userSettingsCache(CacheSpec spec) {
      this.userSettings = spec;
      return this;
    }

    /** Optional. Defaults to 10 minutes / 2000 entries. */
    public Builder economyCache(CacheSpec spec) {
      this.economy = spec;
      return this;
    }

    /** Optional. Defaults to 5 minutes / 2000 entries. */
    public Builder levelsCache(CacheSpec spec) {
      this.levels = spec;
      return this;
    }

    /**
     * Sets how often every cache sweeps expired entries.
     *
     * <p>Optional. Defaults to 5 minutes. Must be &gt; 0.
     */
    public Builder cacheCleanupInterval(Duration cleanupInterval) {
      this.cleanupInterval = cleanupInterval;
      return this;
    }

    /**
     * Sets the metrics exporter for cache hits and misses.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the clock used for cache expiry and row timestamps.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Builds the store and starts the cache sweepers. Does not contact the database.
     *
     * @throws NullPointerException     if {@code dataSource} or another value is null
     * @throws IllegalArgumentException if {@code cacheCleanupInterval} is not positive
     */
    public CachedRemoteStore build() {
      return new CachedRemoteStore(this);
    }
  }
}
