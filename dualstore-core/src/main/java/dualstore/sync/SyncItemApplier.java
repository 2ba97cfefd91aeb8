package dualstore.sync;

import dualstore.model.SyncOperation;
import dualstore.model.SyncQueueItem;
import dualstore.model.SyncTable;
import dualstore.model.UserSettings;
import dualstore.spi.RemoteStore;
import dualstore.util.JsonCodec;

import java.util.Map;
import java.util.Objects;

/**
 * Re-applies a queued local mutation to the remote store.
 *
 * <p>Routing by {@code (table, operation)}:
 * <ul>
 *   <li>{@code guild_settings / UPDATE}: each of {@code lang}, {@code prefix} and
 *       {@code welcome_channel_id} present in the payload is written
 *   <li>{@code user_settings / UPDATE}: full settings replacement
 *   <li>{@code economy / ADD}, {@code economy / REMOVE}: balance delta
 *   <li>{@code levels / ADD_XP}: experience delta
 * </ul>
 * Absolute updates are idempotent. Deltas are applied again on every replay, so an item whose
 * earlier attempt timed out after reaching the database is counted twice.
 */
public final class SyncItemApplier {
  private final RemoteStore remote;
  private final JsonCodec jsonCodec;

  public SyncItemApplier(RemoteStore remote) {
    this(remote, JsonCodec.getDefault());
  }

  public SyncItemApplier(RemoteStore remote, JsonCodec jsonCodec) {
    this.remote = Objects.requireNonNull(remote, "remote");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  /**
   * Applies one item.
   *
   * @throws UnroutableSyncItemException if the item cannot be mapped to a remote operation
   * @throws RuntimeException            if the remote call itself fails
   */
  public void apply(SyncQueueItem item) throws UnroutableSyncItemException {
    SyncTable table;
    SyncOperation operation;
    Map<String, String> payload;
    try {
      table = SyncTable.fromTableName(item.tableName());
      operation = SyncOperation.valueOf(item.operation());
      payload = jsonCodec.parseObject(item.payloadJson());
    } catch (IllegalArgumentException | NullPointerException e) {
      throw new UnroutableSyncItemException("Cannot decode sync item " + item.id()
          + " (" + item.tableName() + "/" + item.operation() + "): " + e.getMessage(), e);
    }

    switch (table) {
      case GUILD_SETTINGS -> applyGuildSettings(item, operation, payload);
      case USER_SETTINGS -> {
        requireOperation(item, operation, SyncOperation.UPDATE);
        remote.setUserSettings(new UserSettings(
            required(item, payload, SyncPayload.USER_ID),
            Boolean.parseBoolean(payload.getOrDefault(SyncPayload.DM_NOTIFICATIONS, "true")),
            Boolean.parseBoolean(payload.getOrDefault(SyncPayload.LEVEL_UP_MESSAGES, "true")),
            payload.get(SyncPayload.TIMEZONE),
            null));
      }
      case ECONOMY -> {
        String userId = required(item, payload, SyncPayload.USER_ID);
        long amount = amount(item, payload);
        if (operation == SyncOperation.ADD) {
          remote.addMoney(userId, amount);
        } else if (operation == SyncOperation.REMOVE) {
          remote.removeMoney(userId, amount);
        } else {
          throw unroutable(item);
        }
      }
      case LEVELS -> {
        requireOperation(item, operation, SyncOperation.ADD_XP);
        remote.addXP(required(item, payload, SyncPayload.USER_ID), amount(item, payload));
      }
      default -> throw unroutable(item);
    }
  }

  private void applyGuildSettings(SyncQueueItem item, SyncOperation operation,
      Map<String, String> payload) throws UnroutableSyncItemException {
    requireOperation(item, operation, SyncOperation.UPDATE);
    String guildId = required(item, payload, SyncPayload.GUILD_ID);
    boolean applied = false;
    if (payload.get(SyncPayload.LANG) != null) {
      remote.setGuildLang(guildId, payload.get(SyncPayload.LANG));
      applied = true;
    }
    if (payload.get(SyncPayload.PREFIX) != null) {
      remote.setGuildPrefix(guildId, payload.get(SyncPayload.PREFIX));
      applied = true;
    }
    // a present key with a null value clears the channel
    if (payload.containsKey(SyncPayload.WELCOME_CHANNEL_ID)) {
      remote.setWelcomeChannel(guildId, payload.get(SyncPayload.WELCOME_CHANNEL_ID));
      applied = true;
    }
    if (!applied) {
      throw new UnroutableSyncItemException(
          "Sync item " + item.id() + " carries no guild setting to apply");
    }
  }

  private static void requireOperation(SyncQueueItem item, SyncOperation actual,
      SyncOperation expected) throws UnroutableSyncItemException {
    if (actual != expected) {
      throw unroutable(item);
    }
  }

  private static String required(SyncQueueItem item, Map<String, String> payload, String key)
      throws UnroutableSyncItemException {
    String value = payload.get(key);
    if (value == null || value.isEmpty()) {
      throw new UnroutableSyncItemException(
          "Sync item " + item.id() + " is missing '" + key + "'");
    }
    return value;
  }

  private static long amount(SyncQueueItem item, Map<String, String> payload)
      throws UnroutableSyncItemException {
    String raw = required(item, payload, SyncPayload.AMOUNT);
    try {
      return Long.parseLong(raw);
    } catch (NumberFormatException e) {
      throw new UnroutableSyncItemException(
          "Sync item " + item.id() + " has a non-numeric amount: " + raw, e);
    }
  }

  private static UnroutableSyncItemException unroutable(SyncQueueItem item) {
    return new UnroutableSyncItemException("No remote operation for "
        + item.tableName() + "/" + item.operation() + " (item " + item.id() + ")");
  }
}
