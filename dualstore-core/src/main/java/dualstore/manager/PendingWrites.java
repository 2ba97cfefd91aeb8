package dualstore.manager;

import dualstore.model.SyncQueueItem;
import dualstore.model.SyncTable;
import dualstore.spi.LocalStore;
import dualstore.sync.SyncPayload;
import dualstore.util.JsonCodec;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entities whose latest local change the remote store has not confirmed.
 *
 * <p>While an entity is pending the manager reads it locally and queues further writes to it
 * behind the earlier ones, so a replay cannot overwrite a newer remote value with an older
 * one. The set is rebuilt from the drainable part of the sync queue after every drain; an
 * entity whose items were all applied (or dead-lettered) is no longer pending.
 */
final class PendingWrites {
  private static final Logger logger = Logger.getLogger(PendingWrites.class.getName());

  /** Queue rows scanned per reload. */
  static final int SCAN_LIMIT = 10_000;

  private final JsonCodec jsonCodec;
  private Set<String> keys = new HashSet<>();

  PendingWrites(JsonCodec jsonCodec) {
    this.jsonCodec = jsonCodec;
  }

  synchronized void mark(SyncTable table, String id) {
    keys.add(key(table, id));
  }

  synchronized boolean contains(SyncTable table, String id) {
    return !keys.isEmpty() && keys.contains(key(table, id));
  }

  synchronized int size() {
    return keys.size();
  }

  /**
   * Replaces the set with the entities that still have drainable queue items. Runs under the
   * same monitor as {@link #mark} so a failure queued during the scan is not lost.
   */
  synchronized void reload(LocalStore store) {
    Set<String> fresh = new HashSet<>();
    for (SyncQueueItem item : store.getSyncQueue(SCAN_LIMIT)) {
      try {
        SyncTable table = SyncTable.fromTableName(item.tableName());
        Map<String, String> payload = jsonCodec.parseObject(item.payloadJson());
        String id = payload.get(idKey(table));
        if (id != null) {
          fresh.add(key(table, id));
        }
      } catch (IllegalArgumentException e) {
        logger.log(Level.FINE, "Skipping undecodable sync item " + item.id(), e);
      }
    }
    keys = fresh;
  }

  private static String idKey(SyncTable table) {
    return table == SyncTable.GUILD_SETTINGS ? SyncPayload.GUILD_ID : SyncPayload.USER_ID;
  }

  private static String key(SyncTable table, String id) {
    return table.tableName() + ':' + id;
  }
}
