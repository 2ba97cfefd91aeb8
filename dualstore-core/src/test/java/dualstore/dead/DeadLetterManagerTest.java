package dualstore.dead;

import dualstore.model.SyncQueueItem;
import dualstore.testing.InMemoryLocalStore;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DeadLetterManagerTest {

  private final InMemoryLocalStore local = new InMemoryLocalStore();
  private final DeadLetterManager manager = new DeadLetterManager(local);

  private long deadItem(String table) {
    long id = local.enqueueRaw(table, "UPDATE", "{}");
    for (int i = 0; i < InMemoryLocalStore.MAX_RETRIES; i++) {
      local.markSyncFailed(id, "no route");
    }
    return id;
  }

  @Test
  void queryAndCountSeeOnlyDeadItems() {
    long dead = deadItem("inventory");
    local.enqueueRaw("economy", "ADD", "{}");

    List<SyncQueueItem> result = manager.query(10);

    assertEquals(1, result.size());
    assertEquals(dead, result.get(0).id());
    assertEquals("no route", result.get(0).lastError());
    assertEquals(1, manager.count());
  }

  @Test
  void replayRearmsItem() {
    long dead = deadItem("inventory");

    assertTrue(manager.replay(dead));

    assertEquals(0, manager.count());
    assertEquals(1, local.countSyncQueue());
  }

  @Test
  void replayOfLiveItemReturnsFalse() {
    long live = local.enqueueRaw("economy", "ADD", "{}");

    assertFalse(manager.replay(live));
  }

  @Test
  void replayAllProcessesBatches() {
    for (int i = 0; i < 5; i++) {
      deadItem("inventory");
    }

    assertEquals(5, manager.replayAll(2));
    assertEquals(0, manager.count());
  }

  @Test
  void storeFailuresAreLoggedNotThrown() {
    InMemoryLocalStore broken = new InMemoryLocalStore() {
      @Override
      public synchronized List<SyncQueueItem> queryDeadLetters(int limit) {
        throw new IllegalStateException("locked");
      }

      @Override
      public synchronized int countDeadLetters() {
        throw new IllegalStateException("locked");
      }
    };
    DeadLetterManager failing = new DeadLetterManager(broken);

    assertTrue(failing.query(5).isEmpty());
    assertEquals(0, failing.count());
    assertEquals(0, failing.replayAll(5));
  }
}
