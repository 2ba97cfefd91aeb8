package dualstore.sync;

import dualstore.model.UserSettings;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Payload keys and builders for sync queue items.
 *
 * <p>Payloads are flat string maps serialized through {@link dualstore.util.JsonCodec}. The
 * same builders are used by the local store when it queues a mutation and by the manager when
 * it queues a failed remote write, so both produce identical items.
 */
public final class SyncPayload {
  public static final String GUILD_ID = "guild_id";
  public static final String USER_ID = "user_id";
  public static final String LANG = "lang";
  public static final String PREFIX = "prefix";
  public static final String WELCOME_CHANNEL_ID = "welcome_channel_id";
  public static final String DM_NOTIFICATIONS = "dm_notifications";
  public static final String LEVEL_UP_MESSAGES = "level_up_messages";
  public static final String TIMEZONE = "timezone";
  public static final String AMOUNT = "amount";

  private SyncPayload() {
  }

  public static Map<String, String> guildLang(String guildId, String lang) {
    Map<String, String> payload = new LinkedHashMap<>();
    payload.put(GUILD_ID, guildId);
    payload.put(LANG, lang);
    return payload;
  }

  public static Map<String, String> guildPrefix(String guildId, String prefix) {
    Map<String, String> payload = new LinkedHashMap<>();
    payload.put(GUILD_ID, guildId);
    payload.put(PREFIX, prefix);
    return payload;
  }

  /**
   * @param channelId channel id, or {@code null} for "clear"
   */
  public static Map<String, String> welcomeChannel(String guildId, String channelId) {
    Map<String, String> payload = new LinkedHashMap<>();
    payload.put(GUILD_ID, guildId);
    payload.put(WELCOME_CHANNEL_ID, channelId);
    return payload;
  }

  public static Map<String, String> userSettings(UserSettings settings) {
    Map<String, String> payload = new LinkedHashMap<>();
    payload.put(USER_ID, settings.userId());
    payload.put(DM_NOTIFICATIONS, Boolean.toString(settings.dmNotifications()));
    payload.put(LEVEL_UP_MESSAGES, Boolean.toString(settings.levelUpMessages()));
    payload.put(TIMEZONE, settings.timezone());
    return payload;
  }

  /** Payload for the delta operations: money added or removed, experience added. */
  public static Map<String, String> amount(String userId, long amount) {
    Map<String, String> payload = new LinkedHashMap<>();
    payload.put(USER_ID, userId);
    payload.put(AMOUNT, Long.toString(amount));
    return payload;
  }
}
