package dualstore.spi;

import dualstore.model.GuildSettings;
import dualstore.model.LevelProgress;
import dualstore.model.LevelRecord;
import dualstore.model.RemoteCacheStats;
import dualstore.model.UserSettings;
import dualstore.model.WithdrawResult;

import java.time.Duration;

/**
 * Authoritative remote store, usually fronted by read-through caches.
 *
 * <p>Data methods may block on the network and may throw unchecked exceptions of any kind;
 * the manager runs them under a deadline and treats every failure alike.
 * {@link #checkHealth(Duration)} never throws.
 */
public interface RemoteStore extends AutoCloseable {

  String getGuildLang(String guildId);

  String getGuildPrefix(String guildId);

  String getWelcomeChannel(String guildId);

  GuildSettings getGuildSettings(String guildId);

  UserSettings getUserSettings(String userId);

  long getBalance(String userId);

  LevelRecord getLevel(String userId);

  void setGuildLang(String guildId, String lang);

  void setGuildPrefix(String guildId, String prefix);

  void setWelcomeChannel(String guildId, String channelId);

  void setUserSettings(UserSettings settings);

  long addMoney(String userId, long amount);

  WithdrawResult removeMoney(String userId, long amount);

  LevelProgress addXP(String userId, long amount);

  /**
   * Probes the remote store with a trivial query.
   *
   * @param timeout how long to wait for the probe
   * @return {@code true} if the probe answered in time
   */
  boolean checkHealth(Duration timeout);

  RemoteCacheStats cacheStats();

  void invalidateGuildCache(String guildId);

  void invalidateUserCache(String userId);

  @Override
  void close();
}
