package dualstore.jdbc.local;

import dualstore.StoreInitializationException;
import dualstore.jdbc.JdbcStoreException;
import dualstore.jdbc.JdbcTemplate;
import dualstore.jdbc.LocalStoreException;
import dualstore.jdbc.SchemaScripts;
import dualstore.jdbc.dialect.H2Dialect;
import dualstore.jdbc.spi.Dialect;
import dualstore.model.GuildSettings;
import dualstore.model.LevelProgress;
import dualstore.model.LevelRecord;
import dualstore.model.SyncOperation;
import dualstore.model.SyncQueueItem;
import dualstore.model.SyncTable;
import dualstore.model.UserSettings;
import dualstore.model.WithdrawResult;
import dualstore.spi.LocalStore;
import dualstore.sync.SyncPayload;
import dualstore.util.JsonCodec;
import org.h2.jdbcx.JdbcConnectionPool;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link LocalStore} on an embedded H2 file database.
 *
 * <p>Opening the store creates the database file and any missing table. Any failure while
 * opening is fatal and reported as {@link StoreInitializationException}; nothing is left open.
 * Statement failures afterwards surface as {@link LocalStoreException}.
 *
 * <p>Mutations are serialized on a store-wide lock. Each one runs in a single transaction
 * together with its sync queue insert, so a queued change can never exist without the local
 * row it describes, nor the other way round.
 *
 * <pre>{@code
 * DurableLocalStore local = DurableLocalStore.builder()
 *     .path(Path.of("data/local-backup"))
 *     .open();
 * }</pre>
 */
public final class DurableLocalStore implements LocalStore {
  private static final Logger logger = Logger.getLogger(DurableLocalStore.class.getName());

  static final int MAX_ERROR_LENGTH = 4000;
  private static final int CLEAR_BATCH_SIZE = 1000;

  private static final String QUEUE_COLUMNS =
      "id, table_name, operation, data, created_at, retries, last_error";

  private final JdbcConnectionPool pool;
  private final String url;
  private final Dialect dialect = new H2Dialect();
  private final Clock clock;
  private final int maxRetries;
  private final Duration retention;
  private final JsonCodec jsonCodec;
  private final ReentrantLock writeLock = new ReentrantLock();

  private DurableLocalStore(JdbcConnectionPool pool, String url, Builder builder) {
    this.pool = pool;
    this.url = url;
    this.clock = builder.clock;
    this.maxRetries = builder.maxRetries;
    this.retention = builder.retention;
    this.jsonCodec = builder.jsonCodec;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Opens (creating if needed) the database at {@code path} with default settings.
   *
   * @throws StoreInitializationException if the database cannot be opened
   */
  public static DurableLocalStore open(Path path) {
    return builder().path(path).open();
  }

  /** JDBC URL of the underlying database. */
  public String url() {
    return url;
  }

  public int maxRetries() {
    return maxRetries;
  }

  // ── reads ─────────────────────────────────────────────────────

  @Override
  public String getGuildLang(String guildId) {
    return getGuildSettings(guildId).lang();
  }

  @Override
  public String getGuildPrefix(String guildId) {
    return getGuildSettings(guildId).prefix();
  }

  @Override
  public String getWelcomeChannel(String guildId) {
    return getGuildSettings(guildId).welcomeChannelId();
  }

  @Override
  public GuildSettings getGuildSettings(String guildId) {
    return withConnection("read guild settings", conn -> JdbcTemplate.queryOne(conn,
            "SELECT guild_id, lang, prefix, welcome_channel_id, updated_at"
                + " FROM guild_settings WHERE guild_id = ?",
            DurableLocalStore::mapGuild, guildId)
        .orElseGet(() -> GuildSettings.defaults(guildId)));
  }

  @Override
  public UserSettings getUserSettings(String userId) {
    return withConnection("read user settings", conn -> JdbcTemplate.queryOne(conn,
            "SELECT user_id, dm_notifications, level_up_messages, timezone, updated_at"
                + " FROM user_settings WHERE user_id = ?",
            DurableLocalStore::mapUser, userId)
        .orElseGet(() -> UserSettings.defaults(userId)));
  }

  @Override
  public long getBalance(String userId) {
    return withConnection("read balance", conn -> selectBalance(conn, userId));
  }

  @Override
  public LevelRecord getLevel(String userId) {
    return withConnection("read level", conn -> JdbcTemplate.queryOne(conn,
            "SELECT user_id, xp, level, updated_at FROM levels WHERE user_id = ?",
            rs -> new LevelRecord(rs.getString(1), rs.getLong(2), rs.getInt(3),
                toInstant(rs.getTimestamp(4))),
            userId)
        .orElseGet(() -> LevelRecord.empty(userId)));
  }

  // ── writes ────────────────────────────────────────────────────

  @Override
  public void setGuildLang(String guildId, String lang, boolean enqueue) {
    Objects.requireNonNull(lang, "lang");
    mutate("set guild lang", conn -> {
      upsert(conn, "guild_settings", "guild_id", List.of("lang", "updated_at"),
          guildId, lang, now());
      if (enqueue) {
        insertQueueItem(conn, SyncTable.GUILD_SETTINGS, SyncOperation.UPDATE,
            SyncPayload.guildLang(guildId, lang));
      }
      return null;
    });
  }

  @Override
  public void setGuildPrefix(String guildId, String prefix, boolean enqueue) {
    Objects.requireNonNull(prefix, "prefix");
    mutate("set guild prefix", conn -> {
      upsert(conn, "guild_settings", "guild_id", List.of("prefix", "updated_at"),
          guildId, prefix, now());
      if (enqueue) {
        insertQueueItem(conn, SyncTable.GUILD_SETTINGS, SyncOperation.UPDATE,
            SyncPayload.guildPrefix(guildId, prefix));
      }
      return null;
    });
  }

  @Override
  public void setWelcomeChannel(String guildId, String channelId, boolean enqueue) {
    mutate("set welcome channel", conn -> {
      upsert(conn, "guild_settings", "guild_id", List.of("welcome_channel_id", "updated_at"),
          guildId, channelId, now());
      if (enqueue) {
        insertQueueItem(conn, SyncTable.GUILD_SETTINGS, SyncOperation.UPDATE,
            SyncPayload.welcomeChannel(guildId, channelId));
      }
      return null;
    });
  }

  @Override
  public void setUserSettings(UserSettings settings, boolean enqueue) {
    Objects.requireNonNull(settings, "settings");
    mutate("set user settings", conn -> {
      upsert(conn, "user_settings", "user_id",
          List.of("dm_notifications", "level_up_messages", "timezone", "updated_at"),
          settings.userId(), settings.dmNotifications(), settings.levelUpMessages(),
          settings.timezone(), now());
      if (enqueue) {
        insertQueueItem(conn, SyncTable.USER_SETTINGS, SyncOperation.UPDATE,
            SyncPayload.userSettings(settings));
      }
      return null;
    });
  }

  @Override
  public long addMoney(String userId, long amount, boolean enqueue) {
    return mutate("add money", conn -> {
      long balance = dialect.incrementAndGet(conn, "economy", "user_id", "balance",
          userId, amount, now());
      if (enqueue) {
        insertQueueItem(conn, SyncTable.ECONOMY, SyncOperation.ADD,
            SyncPayload.amount(userId, amount));
      }
      return balance;
    });
  }

  @Override
  public WithdrawResult removeMoney(String userId, long amount, boolean enqueue) {
    return mutate("remove money", conn -> {
      int updated = JdbcTemplate.update(conn,
          "UPDATE economy SET balance = balance - ?, updated_at = ?"
              + " WHERE user_id = ? AND balance >= ?",
          amount, now(), userId, amount);
      long balance = selectBalance(conn, userId);
      if (updated == 0) {
        return new WithdrawResult(false, balance);
      }
      if (enqueue) {
        insertQueueItem(conn, SyncTable.ECONOMY, SyncOperation.REMOVE,
            SyncPayload.amount(userId, amount));
      }
      return new WithdrawResult(true, balance);
    });
  }

  @Override
  public LevelProgress addXP(String userId, long amount, boolean enqueue) {
    return mutate("add xp", conn -> {
      long xp = dialect.incrementAndGet(conn, "levels", "user_id", "xp",
          userId, amount, now());
      int stored = JdbcTemplate.queryOne(conn,
              "SELECT level FROM levels WHERE user_id = ?", rs -> rs.getInt(1), userId)
          .orElse(1);
      int computed = LevelRecord.levelForXp(xp);
      boolean levelUp = computed > stored;
      if (levelUp) {
        JdbcTemplate.update(conn, "UPDATE levels SET level = ? WHERE user_id = ?",
            computed, userId);
      }
      if (enqueue) {
        insertQueueItem(conn, SyncTable.LEVELS, SyncOperation.ADD_XP,
            SyncPayload.amount(userId, amount));
      }
      return new LevelProgress(levelUp, xp, Math.max(computed, stored));
    });
  }

  // ── sync queue ────────────────────────────────────────────────

  @Override
  public void enqueue(SyncTable table, SyncOperation operation, Map<String, String> payload) {
    mutate("enqueue sync item", conn -> {
      insertQueueItem(conn, table, operation, payload);
      return null;
    });
  }

  @Override
  public List<SyncQueueItem> getSyncQueue(int limit) {
    return withConnection("read sync queue", conn -> JdbcTemplate.query(conn,
        "SELECT " + QUEUE_COLUMNS + " FROM sync_queue WHERE retries < ? ORDER BY id LIMIT ?",
        DurableLocalStore::mapQueueItem, maxRetries, limit));
  }

  @Override
  public int countSyncQueue() {
    return withConnection("count sync queue", conn -> count(conn,
        "SELECT COUNT(*) FROM sync_queue WHERE retries < ?"));
  }

  @Override
  public void markSyncSuccess(long id) {
    mutate("mark sync success", conn ->
        JdbcTemplate.update(conn, "DELETE FROM sync_queue WHERE id = ?", id));
  }

  @Override
  public void markSyncFailed(long id, String error) {
    mutate("mark sync failed", conn -> JdbcTemplate.update(conn,
        "UPDATE sync_queue SET retries = retries + 1, last_error = ? WHERE id = ?",
        truncate(error), id));
  }

  @Override
  public int clearOldSyncQueue() {
    Instant cutoff = clock.instant().minus(retention);
    int total = 0;
    int deleted;
    do {
      deleted = clearOldSyncQueue(cutoff, CLEAR_BATCH_SIZE);
      total += deleted;
    } while (deleted >= CLEAR_BATCH_SIZE);
    if (total > 0) {
      logger.log(Level.INFO, "Cleared {0} old or dead sync queue items", total);
    }
    return total;
  }

  @Override
  public int clearOldSyncQueue(Instant cutoff, int batchSize) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    return mutate("purge sync queue", conn -> JdbcTemplate.update(conn,
        "DELETE FROM sync_queue WHERE id IN ("
            + "SELECT id FROM sync_queue WHERE created_at < ? OR retries >= ?"
            + " ORDER BY id LIMIT ?)",
        Timestamp.from(cutoff), maxRetries, batchSize));
  }

  // ── dead letters ──────────────────────────────────────────────

  @Override
  public List<SyncQueueItem> queryDeadLetters(int limit) {
    return withConnection("read dead letters", conn -> JdbcTemplate.query(conn,
        "SELECT " + QUEUE_COLUMNS + " FROM sync_queue WHERE retries >= ? ORDER BY id LIMIT ?",
        DurableLocalStore::mapQueueItem, maxRetries, limit));
  }

  @Override
  public int countDeadLetters() {
    return withConnection("count dead letters", conn -> count(conn,
        "SELECT COUNT(*) FROM sync_queue WHERE retries >= ?"));
  }

  @Override
  public boolean replayDeadLetter(long id) {
    return mutate("replay dead letter", conn -> JdbcTemplate.update(conn,
        "UPDATE sync_queue SET retries = 0 WHERE id = ? AND retries >= ?",
        id, maxRetries) == 1);
  }

  @Override
  public void close() {
    pool.dispose();
    logger.log(Level.INFO, "Local store closed: {0}", url);
  }

  // ── internals ─────────────────────────────────────────────────

  @FunctionalInterface
  private interface SqlWork<T> {
    T run(Connection conn) throws SQLException;
  }

  private <T> T withConnection(String what, SqlWork<T> work) {
    try (Connection conn = pool.getConnection()) {
      return work.run(conn);
    } catch (SQLException | JdbcStoreException e) {
      throw new LocalStoreException("Local store failed to " + what, e);
    }
  }

  private <T> T mutate(String what, SqlWork<T> work) {
    writeLock.lock();
    try (Connection conn = pool.getConnection()) {
      conn.setAutoCommit(false);
      try {
        T result = work.run(conn);
        conn.commit();
        return result;
      } catch (SQLException | RuntimeException e) {
        rollbackQuietly(conn, e);
        throw e;
      } finally {
        conn.setAutoCommit(true);
      }
    } catch (SQLException | JdbcStoreException e) {
      throw new LocalStoreException("Local store failed to " + what, e);
    } finally {
      writeLock.unlock();
    }
  }

  private static void rollbackQuietly(Connection conn, Exception cause) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }

  private void upsert(Connection conn, String table, String keyColumn, List<String> columns,
      Object... params) {
    JdbcTemplate.update(conn, dialect.upsertSql(table, keyColumn, columns), params);
  }

  private void insertQueueItem(Connection conn, SyncTable table, SyncOperation operation,
      Map<String, String> payload) {
    JdbcTemplate.update(conn,
        "INSERT INTO sync_queue (table_name, operation, data, created_at, retries)"
            + " VALUES (?, ?, ?, ?, 0)",
        table.tableName(), operation.name(), jsonCodec.toJson(payload), now());
  }

  private int count(Connection conn, String sql) {
    return JdbcTemplate.queryOne(conn, sql, rs -> rs.getInt(1), maxRetries).orElse(0);
  }

  private static long selectBalance(Connection conn, String userId) {
    return JdbcTemplate.queryOne(conn, "SELECT balance FROM economy WHERE user_id = ?",
        rs -> rs.getLong(1), userId).orElse(0L);
  }

  private Timestamp now() {
    return Timestamp.from(clock.instant());
  }

  static String truncate(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH);
  }

  private static Instant toInstant(Timestamp ts) {
    return ts == null ? null : ts.toInstant();
  }

  private static GuildSettings mapGuild(ResultSet rs) throws SQLException {
    return new GuildSettings(rs.getString(1), rs.getString(2), rs.getString(3),
        rs.getString(4), toInstant(rs.getTimestamp(5)));
  }

  private static UserSettings mapUser(ResultSet rs) throws SQLException {
    return new UserSettings(rs.getString(1), rs.getBoolean(2), rs.getBoolean(3),
        rs.getString(4), toInstant(rs.getTimestamp(5)));
  }

  private static SyncQueueItem mapQueueItem(ResultSet rs) throws SQLException {
    return new SyncQueueItem(rs.getLong(1), rs.getString(2), rs.getString(3), rs.getString(4),
        toInstant(rs.getTimestamp(5)), rs.getInt(6), rs.getString(7));
  }

  /**
   * Builder for {@link DurableLocalStore}.
   */
  public static final class Builder {
    private Path path = Path.of("data", "local-backup");
    private String url;
    private Clock clock = Clock.systemUTC();
    private int maxRetries = 5;
    private Duration retention = Duration.ofDays(7);
    private JsonCodec jsonCodec = JsonCodec.getDefault();

    private Builder() {
    }

    /**
     * Sets the database file path, without H2's {@code .mv.db} suffix. Parent directories are
     * created on open.
     *
     * <p>Optional. Defaults to {@code data/local-backup}.
     */
    public Builder path(Path path) {
      this.path = path;
      return this;
    }

    /**
     * Uses an explicit H2 JDBC URL instead of {@link #path(Path)}, e.g. an in-memory database
     * in tests.
     *
     * <p>Optional.
     */
    public Builder url(String url) {
      this.url = url;
      return this;
    }

    /**
     * Sets the clock used for row and queue timestamps.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets how many failed replays make a queue item dead.
     *
     * <p>Optional. Defaults to {@code 5}. Must be &gt; 0.
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * Sets how long queue items are kept before {@link #clearOldSyncQueue()} deletes them.
     *
     * <p>Optional. Defaults to 7 days. Must be &gt; 0.
     */
    public Builder retention(Duration retention) {
      this.retention = retention;
      return this;
    }

    /**
     * Sets the codec for queue payloads.
     *
     * <p>Optional. Defaults to {@link JsonCodec#getDefault()}.
     */
    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    /**
     * Opens the database, creating the file and schema when missing.
     *
     * @throws NullPointerException         if a required value is null
     * @throws IllegalArgumentException     if {@code maxRetries} or {@code retention} is not
     *                                      positive
     * @throws StoreInitializationException if the database cannot be opened or initialized
     */
    public DurableLocalStore open() {
      Objects.requireNonNull(clock, "clock");
      Objects.requireNonNull(retention, "retention");
      Objects.requireNonNull(jsonCodec, "jsonCodec");
      if (maxRetries <= 0) {
        throw new IllegalArgumentException("maxRetries must be > 0");
      }
      if (retention.isNegative() || retention.isZero()) {
        throw new IllegalArgumentException("retention must be > 0");
      }
      String jdbcUrl = url;
      if (jdbcUrl == null) {
        Objects.requireNonNull(path, "path");
        Path absolute = path.toAbsolutePath();
        try {
          if (absolute.getParent() != null) {
            Files.createDirectories(absolute.getParent());
          }
        } catch (IOException e) {
          throw new StoreInitializationException(
              "Cannot create local store directory for " + absolute, e);
        }
        jdbcUrl = "jdbc:h2:file:" + absolute;
      }

      JdbcConnectionPool pool = JdbcConnectionPool.create(jdbcUrl, "sa", "");
      try (Connection conn = pool.getConnection()) {
        SchemaScripts.apply(conn, SchemaScripts.H2);
      } catch (SQLException | IOException | RuntimeException e) {
        pool.dispose();
        throw new StoreInitializationException("Cannot open local store at " + jdbcUrl, e);
      }
      logger.log(Level.INFO, "Local store opened: {0}", jdbcUrl);
      return new DurableLocalStore(pool, jdbcUrl, this);
    }
  }
}
