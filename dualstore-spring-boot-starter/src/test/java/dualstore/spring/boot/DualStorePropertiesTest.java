package dualstore.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DualStorePropertiesTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(PropsConfig.class);

  @Test
  void defaultValues() {
    runner.run(ctx -> {
      var props = ctx.getBean(DualStoreProperties.class);
      assertFalse(props.isForceOffline());
      assertTrue(props.isQueueFailedRemoteWrites());
      assertEquals(Duration.ofMillis(3000), props.getInitialHealthCheckTimeout());
      assertEquals(Duration.ofMillis(2000), props.getHealthCheckTimeout());
      assertEquals(Duration.ofMillis(800), props.getReadTimeout());
      assertEquals(Duration.ofMillis(1000), props.getWriteTimeout());
      assertEquals(Duration.ofSeconds(30), props.getHealthCheckInterval());
      assertEquals(Duration.ofMinutes(5), props.getReconnectDelay());
      assertEquals(4, props.getRemoteWorkers());
      assertEquals(64, props.getRemoteQueueCapacity());
      assertEquals("data/local-backup", props.getLocal().getPath());
      assertTrue(props.getRemote().isEnabled());
      assertEquals(Duration.ofMinutes(5), props.getRemote().getCacheCleanupInterval());
      assertEquals(Duration.ofSeconds(60), props.getSync().getInterval());
      assertEquals(100, props.getSync().getBatchSize());
      assertEquals(Duration.ofDays(7), props.getQueue().getRetention());
      assertEquals(5, props.getQueue().getMaxRetries());
      assertEquals(Duration.ofHours(1), props.getQueue().getPurgeInterval());
      assertEquals(Duration.ofMinutes(30), props.getCache().getGuildSettings().getTtl());
      assertEquals(500, props.getCache().getGuildSettings().getMaxSize());
      assertEquals(1000, props.getCache().getUserSettings().getMaxSize());
      assertEquals(Duration.ofMinutes(10), props.getCache().getEconomy().getTtl());
      assertEquals(2000, props.getCache().getEconomy().getMaxSize());
      assertEquals(Duration.ofMinutes(5), props.getCache().getLevels().getTtl());
      assertTrue(props.getMetrics().isEnabled());
      assertEquals("dualstore", props.getMetrics().getNamePrefix());
    });
  }

  @Test
  void customValues() {
    runner.withPropertyValues(
        "dualstore.force-offline=true",
        "dualstore.queue-failed-remote-writes=false",
        "dualstore.read-timeout=250ms",
        "dualstore.reconnect-delay=PT1M",
        "dualstore.remote-workers=8",
        "dualstore.remote-queue-capacity=16",
        "dualstore.local.path=/var/lib/bot/backup",
        "dualstore.remote.enabled=false",
        "dualstore.sync.interval=10s",
        "dualstore.sync.batch-size=25",
        "dualstore.queue.retention=3d",
        "dualstore.queue.max-retries=9",
        "dualstore.cache.economy.ttl=1m",
        "dualstore.cache.levels.max-size=50",
        "dualstore.metrics.name-prefix=bot.store"
    ).run(ctx -> {
      var props = ctx.getBean(DualStoreProperties.class);
      assertTrue(props.isForceOffline());
      assertFalse(props.isQueueFailedRemoteWrites());
      assertEquals(Duration.ofMillis(250), props.getReadTimeout());
      assertEquals(Duration.ofMinutes(1), props.getReconnectDelay());
      assertEquals(8, props.getRemoteWorkers());
      assertEquals(16, props.getRemoteQueueCapacity());
      assertEquals("/var/lib/bot/backup", props.getLocal().getPath());
      assertFalse(props.getRemote().isEnabled());
      assertEquals(Duration.ofSeconds(10), props.getSync().getInterval());
      assertEquals(25, props.getSync().getBatchSize());
      assertEquals(Duration.ofDays(3), props.getQueue().getRetention());
      assertEquals(9, props.getQueue().getMaxRetries());
      assertEquals(Duration.ofMinutes(1), props.getCache().getEconomy().getTtl());
      // untouched half of a partially bound family keeps its default
      assertEquals(2000, props.getCache().getEconomy().getMaxSize());
      assertEquals(50, props.getCache().getLevels().getMaxSize());
      assertEquals(Duration.ofMinutes(5), props.getCache().getLevels().getTtl());
      assertEquals("bot.store", props.getMetrics().getNamePrefix());
    });
  }

  @Test
  void familyConvertsToValidatedCacheSpec() {
    var family = new DualStoreProperties.Family();
    family.setTtl(Duration.ofSeconds(5));
    family.setMaxSize(3);
    var spec = family.toSpec();
    assertEquals(Duration.ofSeconds(5), spec.ttl());
    assertEquals(3, spec.maxSize());
  }

  @Configuration
  @EnableConfigurationProperties(DualStoreProperties.class)
  static class PropsConfig {
  }
}
