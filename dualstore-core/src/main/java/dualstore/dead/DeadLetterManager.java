package dualstore.dead;

import dualstore.model.SyncQueueItem;
import dualstore.spi.LocalStore;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Convenience facade for inspecting and replaying sync queue items that ran out of retries.
 *
 * <p>Replaying resets an item's retry counter, so the next drain cycle tries it again. Items
 * that fail to route (unknown table or operation) will simply die again.
 *
 * @see LocalStore#queryDeadLetters
 * @see LocalStore#replayDeadLetter
 */
public final class DeadLetterManager {
  private static final Logger logger = Logger.getLogger(DeadLetterManager.class.getName());

  private final LocalStore localStore;

  public DeadLetterManager(LocalStore localStore) {
    this.localStore = Objects.requireNonNull(localStore, "localStore");
  }

  /**
   * @param limit maximum number of items to return
   * @return dead items, oldest first; empty if the query failed
   */
  public List<SyncQueueItem> query(int limit) {
    try {
      return localStore.queryDeadLetters(limit);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to query dead sync items", e);
      return List.of();
    }
  }

  /**
   * @return {@code true} if the item was dead and has been re-armed
   */
  public boolean replay(long id) {
    try {
      return localStore.replayDeadLetter(id);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to replay dead sync item: " + id, e);
      return false;
    }
  }

  /**
   * Re-arms every dead item, processing in batches.
   *
   * @return total number of items re-armed
   */
  public int replayAll(int batchSize) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    int totalReplayed = 0;
    List<SyncQueueItem> batch;
    do {
      batch = query(batchSize);
      int batchReplayed = 0;
      for (SyncQueueItem item : batch) {
        if (replay(item.id())) {
          batchReplayed++;
        }
      }
      if (batchReplayed == 0) {
        break;
      }
      totalReplayed += batchReplayed;
    } while (batch.size() >= batchSize);
    if (totalReplayed > 0) {
      logger.log(Level.INFO, "Re-armed {0} dead sync items", totalReplayed);
    }
    return totalReplayed;
  }

  /**
   * @return the number of dead items, or {@code 0} if counting failed
   */
  public int count() {
    try {
      return localStore.countDeadLetters();
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to count dead sync items", e);
      return 0;
    }
  }
}
