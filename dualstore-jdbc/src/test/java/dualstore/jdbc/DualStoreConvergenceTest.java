package dualstore.jdbc;

import dualstore.StoreInitializationException;
import dualstore.jdbc.local.DurableLocalStore;
import dualstore.jdbc.remote.CachedRemoteStore;
import dualstore.manager.ManagerStats;
import dualstore.manager.ResilientManager;
import dualstore.model.StoreMode;
import dualstore.model.UserSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the manager over the real stores: an embedded local database and an H2 database
 * standing in for the remote, reachable or not at the flip of a switch.
 */
class DualStoreConvergenceTest {
  private String remoteUrl;
  private SwitchableDataSource remoteDs;
  private DurableLocalStore local;
  private ResilientManager manager;

  @TempDir
  Path dir;

  @BeforeEach
  void setup() throws Exception {
    remoteUrl = "jdbc:h2:mem:converge_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
    try (Connection conn = DriverManager.getConnection(remoteUrl, "sa", "")) {
      SchemaScripts.apply(conn, SchemaScripts.H2);
    }
    remoteDs = new SwitchableDataSource(remoteUrl);
    local = DurableLocalStore.builder()
        .url("jdbc:h2:mem:converge_local_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1")
        .open();
  }

  @AfterEach
  void tearDown() {
    if (manager != null) {
      manager.shutdown();
    } else {
      local.close();
    }
  }

  private ResilientManager.Builder builder() {
    return ResilientManager.builder()
        .localStore(local)
        .remoteStore(CachedRemoteStore.builder().dataSource(remoteDs).build())
        .reconnectDelay(Duration.ofHours(1))
        .healthCheckInterval(Duration.ofHours(1))
        .syncInterval(Duration.ofHours(1))
        .readTimeout(Duration.ofSeconds(2))
        .writeTimeout(Duration.ofSeconds(2));
  }

  private <T> T remoteValue(String sql, Class<T> type) throws Exception {
    try (Connection conn = DriverManager.getConnection(remoteUrl, "sa", "")) {
      List<T> rows = JdbcTemplate.query(conn, sql, rs -> rs.getObject(1, type));
      return rows.isEmpty() ? null : rows.get(0);
    }
  }

  @Test
  void offlineWritesConvergeOnReconnect() throws Exception {
    remoteDs.down = true;
    manager = builder().build();
    assertEquals(StoreMode.LOCAL, manager.start());

    manager.setGuildLang("g1", "de");
    manager.setGuildLang("g1", "fr");
    manager.setWelcomeChannel("g1", "welcome");
    manager.setUserSettings(new UserSettings("u1", false, true, "Asia/Seoul", null));
    assertEquals(100L, manager.addMoney("u1", 100));
    assertTrue(manager.removeMoney("u1", 30).success());
    assertTrue(manager.addXP("u1", 1500).levelUp());

    assertEquals("fr", manager.getGuildLang("g1"));
    assertEquals(70L, manager.getBalance("u1"));
    assertEquals(7, manager.getStats().syncQueueSize());

    remoteDs.down = false;
    assertTrue(manager.attemptReconnect());

    assertEquals(StoreMode.REMOTE, manager.getMode());
    assertEquals(0, local.countSyncQueue());
    assertEquals("fr", remoteValue("SELECT lang FROM guild_settings WHERE guild_id = 'g1'",
        String.class));
    assertEquals("welcome", remoteValue(
        "SELECT welcome_channel_id FROM guild_settings WHERE guild_id = 'g1'", String.class));
    assertEquals("Asia/Seoul", remoteValue(
        "SELECT timezone FROM user_settings WHERE user_id = 'u1'", String.class));
    assertEquals(70L, remoteValue("SELECT balance FROM economy WHERE user_id = 'u1'",
        Long.class));
    assertEquals(2, remoteValue("SELECT level FROM levels WHERE user_id = 'u1'",
        Integer.class));

    assertEquals("fr", manager.getGuildLang("g1"));
    assertEquals(70L, manager.getBalance("u1"));
  }

  @Test
  void remoteModeWritesThroughAndFallsBackWhenRemoteDies() throws Exception {
    manager = builder().build();
    assertEquals(StoreMode.REMOTE, manager.start());

    manager.setGuildPrefix("g1", "?");
    assertEquals("?", remoteValue("SELECT prefix FROM guild_settings WHERE guild_id = 'g1'",
        String.class));
    assertEquals("?", manager.getGuildPrefix("g1"));
    assertEquals(0, local.countSyncQueue());

    ManagerStats stats = manager.getStats();
    assertNotNull(stats.remoteCacheStats());
    assertTrue(stats.remoteCacheStats().hits() >= 1);

    remoteDs.down = true;
    assertFalse(manager.checkRemoteHealth());
    assertEquals(StoreMode.LOCAL, manager.getMode());

    manager.setGuildPrefix("g1", "!");
    assertEquals("!", manager.getGuildPrefix("g1"));
    assertEquals(1, local.countSyncQueue());
    assertNull(manager.getStats().remoteCacheStats());
  }

  @Test
  void failedDirectWriteIsQueuedAndReplayed() throws Exception {
    manager = builder().build();
    assertEquals(StoreMode.REMOTE, manager.start());

    remoteDs.down = true;
    manager.setGuildLang("g2", "ko");
    assertEquals("ko", manager.getGuildLang("g2"));
    assertEquals(1, local.countSyncQueue());

    remoteDs.down = false;
    assertEquals(1, manager.syncToRemote().succeeded());
    assertEquals("ko", remoteValue("SELECT lang FROM guild_settings WHERE guild_id = 'g2'",
        String.class));
  }

  @Test
  void unopenableLocalStoreFailsBeforeAnyRemoteContact() throws Exception {
    local.close();
    Path file = Files.writeString(dir.resolve("plain-file"), "x");
    manager = ResilientManager.builder()
        .localStore(() -> DurableLocalStore.open(file.resolve("backup")))
        .remoteStore(CachedRemoteStore.builder().dataSource(remoteDs).build())
        .build();

    assertThrows(StoreInitializationException.class, manager::start);
    assertEquals(0, remoteDs.connectionAttempts());
    assertEquals(StoreMode.UNKNOWN, manager.getMode());
  }

  @Test
  void forceOfflineNeverTouchesRemote() {
    manager = builder().forceOffline(true).build();

    assertEquals(StoreMode.DISABLED, manager.start());
    manager.addMoney("u1", 5);

    assertEquals(5L, manager.getBalance("u1"));
    assertEquals(1, local.countSyncQueue());
    assertEquals(0, remoteDs.connectionAttempts());
  }
}
