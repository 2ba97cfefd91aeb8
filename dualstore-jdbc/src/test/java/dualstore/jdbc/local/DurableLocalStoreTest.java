package dualstore.jdbc.local;

import dualstore.jdbc.TestClock;
import dualstore.model.GuildSettings;
import dualstore.model.LevelProgress;
import dualstore.model.LevelRecord;
import dualstore.model.SyncOperation;
import dualstore.model.SyncQueueItem;
import dualstore.model.SyncTable;
import dualstore.model.UserSettings;
import dualstore.model.WithdrawResult;
import dualstore.sync.SyncPayload;
import dualstore.util.JsonCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class DurableLocalStoreTest {
  private final TestClock clock = new TestClock();
  private DurableLocalStore store;

  @BeforeEach
  void setup() {
    store = DurableLocalStore.builder()
        .url("jdbc:h2:mem:local_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1")
        .clock(clock)
        .open();
  }

  @AfterEach
  void tearDown() {
    store.close();
  }

  @Test
  void missingRowsReadAsDefaults() {
    assertEquals("en", store.getGuildLang("g1"));
    assertEquals("r!", store.getGuildPrefix("g1"));
    assertNull(store.getWelcomeChannel("g1"));
    assertEquals(GuildSettings.defaults("g1"), store.getGuildSettings("g1"));
    assertEquals(UserSettings.defaults("u1"), store.getUserSettings("u1"));
    assertEquals(0L, store.getBalance("u1"));
    assertEquals(LevelRecord.empty("u1"), store.getLevel("u1"));
    assertEquals(0, store.countSyncQueue());
  }

  @Test
  void guildSettersUpsertOnlyTheirColumn() {
    store.setGuildPrefix("g1", "?");
    store.setGuildLang("g1", "de");
    store.setWelcomeChannel("g1", "c9");

    GuildSettings settings = store.getGuildSettings("g1");
    assertEquals("de", settings.lang());
    assertEquals("?", settings.prefix());
    assertEquals("c9", settings.welcomeChannelId());
    assertEquals(clock.instant(), settings.updatedAt());

    store.setWelcomeChannel("g1", null);
    assertNull(store.getWelcomeChannel("g1"));
    assertEquals("de", store.getGuildLang("g1"));
  }

  @Test
  void writesQueueMatchingItemsInOrder() {
    store.setGuildLang("g1", "fr");
    store.setUserSettings(new UserSettings("u1", false, true, "Europe/Paris", null));
    store.addMoney("u1", 50);
    store.removeMoney("u1", 20);
    store.addXP("u1", 10);

    List<SyncQueueItem> items = store.getSyncQueue(10);
    assertEquals(5, items.size());
    assertEquals(List.of("guild_settings", "user_settings", "economy", "economy", "levels"),
        items.stream().map(SyncQueueItem::tableName).toList());
    assertEquals(List.of("UPDATE", "UPDATE", "ADD", "REMOVE", "ADD_XP"),
        items.stream().map(SyncQueueItem::operation).toList());
    assertTrue(items.get(0).id() < items.get(4).id());

    Map<String, String> payload = JsonCodec.getDefault().parseObject(items.get(1).payloadJson());
    assertEquals("u1", payload.get(SyncPayload.USER_ID));
    assertEquals("false", payload.get(SyncPayload.DM_NOTIFICATIONS));
    assertEquals("Europe/Paris", payload.get(SyncPayload.TIMEZONE));
    assertEquals("50", JsonCodec.getDefault().parseObject(items.get(2).payloadJson())
        .get(SyncPayload.AMOUNT));
    assertEquals(clock.instant(), items.get(0).createdAt());
    assertEquals(0, items.get(0).retries());
  }

  @Test
  void writesWithoutEnqueueLeaveQueueEmpty() {
    store.setGuildLang("g1", "fr", false);
    store.addMoney("u1", 5, false);
    store.addXP("u1", 5, false);

    assertEquals("fr", store.getGuildLang("g1"));
    assertEquals(5L, store.getBalance("u1"));
    assertEquals(0, store.countSyncQueue());
  }

  @Test
  void clearedWelcomeChannelIsQueuedAsExplicitNull() {
    store.setWelcomeChannel("g1", null);

    Map<String, String> payload = JsonCodec.getDefault()
        .parseObject(store.getSyncQueue(1).get(0).payloadJson());
    assertTrue(payload.containsKey(SyncPayload.WELCOME_CHANNEL_ID));
    assertNull(payload.get(SyncPayload.WELCOME_CHANNEL_ID));
  }

  @Test
  void addMoneyCreatesRowAndAccumulates() {
    assertEquals(100L, store.addMoney("u1", 100));
    assertEquals(150L, store.addMoney("u1", 50));
    assertEquals(150L, store.getBalance("u1"));
  }

  @Test
  void removeMoneyIsGuardedByBalance() {
    store.addMoney("u1", 30, false);

    WithdrawResult denied = store.removeMoney("u1", 31);
    assertFalse(denied.success());
    assertEquals(30L, denied.balance());
    assertEquals(0, store.countSyncQueue());

    WithdrawResult ok = store.removeMoney("u1", 30);
    assertTrue(ok.success());
    assertEquals(0L, ok.balance());
    assertEquals(1, store.countSyncQueue());
  }

  @Test
  void removeMoneyFromMissingRowFails() {
    WithdrawResult result = store.removeMoney("nobody", 1);

    assertFalse(result.success());
    assertEquals(0L, result.balance());
  }

  @Test
  void addXpRaisesLevelAtThresholds() {
    LevelProgress first = store.addXP("u1", 999);
    assertFalse(first.levelUp());
    assertEquals(1, first.level());

    LevelProgress second = store.addXP("u1", 1);
    assertTrue(second.levelUp());
    assertEquals(2, second.newLevel());
    assertEquals(1000L, second.xp());

    LevelProgress jump = store.addXP("u1", 2500);
    assertTrue(jump.levelUp());
    assertEquals(4, jump.level());
    assertEquals(new LevelRecord("u1", 3500L, 4, clock.instant()), store.getLevel("u1"));
  }

  @Test
  void negativeXpNeverLowersLevel() {
    store.addXP("u1", 2000);
    LevelProgress progress = store.addXP("u1", -1500);

    assertFalse(progress.levelUp());
    assertEquals(500L, progress.xp());
    assertEquals(3, progress.level());
    assertEquals(3, store.getLevel("u1").level());
  }

  @Test
  void failedQueueInsertRollsBackTheRowWrite() {
    DurableLocalStore broken = DurableLocalStore.builder()
        .url("jdbc:h2:mem:broken_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1")
        .jsonCodec(new JsonCodec() {
          @Override
          public String toJson(Map<String, String> payload) {
            throw new IllegalStateException("codec down");
          }

          @Override
          public Map<String, String> parseObject(String json) {
            return Map.of();
          }
        })
        .open();
    try {
      assertThrows(IllegalStateException.class, () -> broken.setGuildLang("g1", "de"));
      assertThrows(IllegalStateException.class, () -> broken.addMoney("u1", 10));

      assertEquals("en", broken.getGuildLang("g1"));
      assertEquals(0L, broken.getBalance("u1"));
      assertEquals(0, broken.countSyncQueue());

      broken.addMoney("u1", 10, false);
      assertEquals(10L, broken.getBalance("u1"));
    } finally {
      broken.close();
    }
  }

  @Test
  void enqueueAppendsWithoutTouchingRows() {
    store.enqueue(SyncTable.ECONOMY, SyncOperation.ADD, SyncPayload.amount("u1", 7));

    assertEquals(0L, store.getBalance("u1"));
    SyncQueueItem item = store.getSyncQueue(5).get(0);
    assertEquals("economy", item.tableName());
    assertEquals("ADD", item.operation());
  }

  @Test
  void successDeletesAndFailureCountsRetries() {
    store.setGuildLang("g1", "de");
    store.setGuildLang("g2", "fr");
    List<SyncQueueItem> items = store.getSyncQueue(10);

    store.markSyncSuccess(items.get(0).id());
    store.markSyncFailed(items.get(1).id(), "boom");

    List<SyncQueueItem> left = store.getSyncQueue(10);
    assertEquals(1, left.size());
    assertEquals(1, left.get(0).retries());
    assertEquals("boom", left.get(0).lastError());
  }

  @Test
  void longErrorsAreTruncated() {
    store.setGuildLang("g1", "de");
    long id = store.getSyncQueue(1).get(0).id();

    store.markSyncFailed(id, "x".repeat(5000));

    assertEquals(DurableLocalStore.MAX_ERROR_LENGTH,
        store.getSyncQueue(1).get(0).lastError().length());
  }

  @Test
  void getSyncQueueHonoursLimit() {
    for (int i = 0; i < 5; i++) {
      store.addMoney("u" + i, 1);
    }

    List<SyncQueueItem> batch = store.getSyncQueue(3);
    assertEquals(3, batch.size());
    assertEquals("{\"user_id\":\"u0\",\"amount\":\"1\"}", batch.get(0).payloadJson());
    assertEquals(5, store.countSyncQueue());
  }

  @Test
  void exhaustedItemsBecomeDeadLettersAndCanBeReplayed() {
    store.setGuildLang("g1", "de");
    store.setGuildLang("g2", "fr");
    long deadId = store.getSyncQueue(1).get(0).id();
    for (int i = 0; i < store.maxRetries(); i++) {
      store.markSyncFailed(deadId, "unreachable");
    }

    assertEquals(1, store.countSyncQueue());
    assertEquals(1, store.countDeadLetters());
    SyncQueueItem dead = store.queryDeadLetters(10).get(0);
    assertEquals(deadId, dead.id());
    assertEquals(5, dead.retries());

    assertTrue(store.replayDeadLetter(deadId));
    assertFalse(store.replayDeadLetter(deadId));
    assertEquals(0, store.countDeadLetters());
    assertEquals(deadId, store.getSyncQueue(10).get(0).id());
  }

  @Test
  void replayOfLiveOrMissingItemIsRejected() {
    store.setGuildLang("g1", "de");
    long liveId = store.getSyncQueue(1).get(0).id();

    assertFalse(store.replayDeadLetter(liveId));
    assertFalse(store.replayDeadLetter(9999L));
  }

  @Test
  void clearOldRemovesExpiredAndDeadItems() {
    store.setGuildLang("old", "de");
    clock.advance(Duration.ofDays(8));
    store.setGuildLang("dead", "fr");
    store.setGuildLang("fresh", "it");
    List<SyncQueueItem> items = store.getSyncQueue(10);
    for (int i = 0; i < 5; i++) {
      store.markSyncFailed(items.get(1).id(), "err");
    }

    assertEquals(2, store.clearOldSyncQueue());

    List<SyncQueueItem> left = store.getSyncQueue(10);
    assertEquals(1, left.size());
    assertEquals(items.get(2).id(), left.get(0).id());
    assertEquals(0, store.countDeadLetters());
  }

  @Test
  void batchedClearStopsAtBatchSize() {
    for (int i = 0; i < 5; i++) {
      store.addMoney("u1", 1);
    }
    clock.advance(Duration.ofDays(1));

    assertEquals(3, store.clearOldSyncQueue(clock.instant(), 3));
    assertEquals(2, store.countSyncQueue());
    assertEquals(2, store.clearOldSyncQueue(clock.instant(), 3));
    assertEquals(0, store.clearOldSyncQueue(clock.instant(), 3));
  }

  @Test
  void builderValidatesArguments() {
    assertThrows(IllegalArgumentException.class,
        () -> DurableLocalStore.builder().maxRetries(0).open());
    assertThrows(IllegalArgumentException.class,
        () -> DurableLocalStore.builder().retention(Duration.ZERO).open());
    assertThrows(NullPointerException.class,
        () -> DurableLocalStore.builder().clock(null).open());
  }
}
