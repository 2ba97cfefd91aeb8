package dualstore.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import dualstore.jdbc.remote.CachedRemoteStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HikariCPIntegrationTest {
  private HikariDataSource hikariDs;

  @BeforeEach
  void setup() throws Exception {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:hikari_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    config.setMaximumPoolSize(5);
    config.setMinimumIdle(1);
    config.setPoolName("dualstore-test-pool");
    hikariDs = new HikariDataSource(config);

    try (Connection conn = hikariDs.getConnection()) {
      SchemaScripts.apply(conn, SchemaScripts.H2);
    }
  }

  @AfterEach
  void tearDown() {
    if (hikariDs != null && !hikariDs.isClosed()) {
      hikariDs.close();
    }
  }

  @Test
  void concurrentAdditionsThroughPool() throws Exception {
    CachedRemoteStore store = CachedRemoteStore.builder().dataSource(hikariDs).build();
    store.addXP("u1", 0);
    int threads = 4;
    int perThread = 25;
    CountDownLatch done = new CountDownLatch(threads);
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    try {
      for (int t = 0; t < threads; t++) {
        pool.execute(() -> {
          try {
            for (int i = 0; i < perThread; i++) {
              store.addXP("u1", 10);
            }
          } finally {
            done.countDown();
          }
        });
      }
      assertTrue(done.await(10, TimeUnit.SECONDS));
      store.invalidateUserCache("u1");

      assertEquals(1000L, store.getLevel("u1").xp());
      assertEquals(2, store.getLevel("u1").level());
    } finally {
      pool.shutdown();
      store.close();
    }
  }

  @Test
  void closeShutsDownOwnedPool() {
    CachedRemoteStore store = CachedRemoteStore.builder().dataSource(hikariDs).build();
    assertTrue(store.checkHealth(Duration.ofSeconds(2)));

    store.close();

    assertTrue(hikariDs.isClosed());
  }

  @Test
  void closeLeavesSharedPoolOpen() {
    CachedRemoteStore store = CachedRemoteStore.builder()
        .dataSource(hikariDs)
        .ownsDataSource(false)
        .build();

    store.close();

    assertFalse(hikariDs.isClosed());
  }
}
