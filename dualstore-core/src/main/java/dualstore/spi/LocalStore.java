package dualstore.spi;

import dualstore.model.GuildSettings;
import dualstore.model.LevelProgress;
import dualstore.model.LevelRecord;
import dualstore.model.SyncOperation;
import dualstore.model.SyncQueueItem;
import dualstore.model.SyncTable;
import dualstore.model.UserSettings;
import dualstore.model.WithdrawResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Durable offline copy of every entity plus the outbound change queue.
 *
 * <p>Every mutation takes an {@code enqueue} flag. When set, the mutation and a matching
 * {@link SyncQueueItem} are written in one local transaction. Reads for rows that were never
 * written return defaults, never {@code null} (except {@link #getWelcomeChannel}).
 *
 * <p>Failures to execute a statement are reported as unchecked exceptions and propagate to
 * the caller.
 */
public interface LocalStore extends AutoCloseable {

  String getGuildLang(String guildId);

  String getGuildPrefix(String guildId);

  /**
   * @return the configured welcome channel, or {@code null} when none is set
   */
  String getWelcomeChannel(String guildId);

  GuildSettings getGuildSettings(String guildId);

  UserSettings getUserSettings(String userId);

  long getBalance(String userId);

  LevelRecord getLevel(String userId);

  void setGuildLang(String guildId, String lang, boolean enqueue);

  default void setGuildLang(String guildId, String lang) {
    setGuildLang(guildId, lang, true);
  }

  void setGuildPrefix(String guildId, String prefix, boolean enqueue);

  default void setGuildPrefix(String guildId, String prefix) {
    setGuildPrefix(guildId, prefix, true);
  }

  /**
   * @param channelId channel id, or {@code null} to clear
   */
  void setWelcomeChannel(String guildId, String channelId, boolean enqueue);

  default void setWelcomeChannel(String guildId, String channelId) {
    setWelcomeChannel(guildId, channelId, true);
  }

  /**
   * Replaces the user's settings with the given values.
   */
  void setUserSettings(UserSettings settings, boolean enqueue);

  default void setUserSettings(UserSettings settings) {
    setUserSettings(settings, true);
  }

  /**
   * Adds {@code amount} to the balance, creating the row when missing.
   *
   * @return the balance after the addition
   */
  long addMoney(String userId, long amount, boolean enqueue);

  default long addMoney(String userId, long amount) {
    return addMoney(userId, amount, true);
  }

  /**
   * Withdraws {@code amount} if the balance covers it. A failed withdrawal changes nothing
   * and is never queued.
   */
  WithdrawResult removeMoney(String userId, long amount, boolean enqueue);

  default WithdrawResult removeMoney(String userId, long amount) {
    return removeMoney(userId, amount, true);
  }

  /**
   * Adds experience and raises the level when the new total crosses a threshold.
   */
  LevelProgress addXP(String userId, long amount, boolean enqueue);

  default LevelProgress addXP(String userId, long amount) {
    return addXP(userId, amount, true);
  }

  /**
   * Appends a queue item without touching any entity table. Used when a direct remote write
   * failed after the local write had already been done.
   */
  void enqueue(SyncTable table, SyncOperation operation, Map<String, String> payload);

  /**
   * Returns up to {@code limit} of the oldest items that still have retries left, oldest first.
   */
  List<SyncQueueItem> getSyncQueue(int limit);

  /**
   * Number of items that still have retries left.
   */
  int countSyncQueue();

  void markSyncSuccess(long id);

  void markSyncFailed(long id, String error);

  /**
   * Deletes items older than the retention period or out of retries.
   *
   * @return number of rows deleted
   */
  int clearOldSyncQueue();

  /**
   * Deletes at most {@code batchSize} items created before {@code cutoff} or out of retries.
   *
   * @return number of rows deleted
   */
  int clearOldSyncQueue(Instant cutoff, int batchSize);

  /**
   * Items that exhausted their retries, oldest first.
   */
  List<SyncQueueItem> queryDeadLetters(int limit);

  int countDeadLetters();

  /**
   * Resets a dead item's retry counter so the next drain picks it up again.
   *
   * @return {@code true} if a dead item with that id existed
   */
  boolean replayDeadLetter(long id);

  @Override
  void close();
}
