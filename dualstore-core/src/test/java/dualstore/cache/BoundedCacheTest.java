package dualstore.cache;

import dualstore.testing.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BoundedCacheTest {

  private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
  private BoundedCache<String> cache;

  @AfterEach
  void tearDown() {
    if (cache != null) {
      cache.destroy();
    }
  }

  private BoundedCache<String> cache(int maxSize, Duration ttl) {
    cache = BoundedCache.builder("test").maxSize(maxSize).ttl(ttl).clock(clock).build();
    return cache;
  }

  @Test
  void getReturnsStoredValueUntilTtlPasses() {
    cache(10, Duration.ofSeconds(30));
    cache.set("lang:1", "es");

    clock.advance(Duration.ofSeconds(30));
    assertEquals("es", cache.get("lang:1"));

    clock.advance(Duration.ofMillis(1));
    assertNull(cache.get("lang:1"));
    assertEquals(0, cache.stats().size());
  }

  @Test
  void perEntryTtlOverridesDefault() {
    cache(10, Duration.ofMinutes(30));
    cache.set("short", "v", Duration.ofSeconds(1));
    cache.set("long", "v");

    clock.advance(Duration.ofSeconds(2));

    assertNull(cache.get("short"));
    assertEquals("v", cache.get("long"));
  }

  @Test
  void evictsOldestInsertedEvenIfRecentlyRead() {
    cache(2, Duration.ofMinutes(5));
    cache.set("a", "1");
    cache.set("b", "2");
    assertEquals("1", cache.get("a"));

    cache.set("c", "3");

    assertNull(cache.get("a"));
    assertEquals("2", cache.get("b"));
    assertEquals("3", cache.get("c"));
  }

  @Test
  void overwriteKeepsInsertionPositionAndDoesNotEvict() {
    cache(2, Duration.ofMinutes(5));
    cache.set("a", "1");
    cache.set("b", "2");
    cache.set("a", "1b");

    assertEquals(List.of("a", "b"), cache.stats().keys());

    cache.set("c", "3");
    assertEquals(List.of("b", "c"), cache.stats().keys());
  }

  @Test
  void cleanupRemovesOnlyExpiredEntries() {
    cache(10, Duration.ofMinutes(1));
    cache.set("old", "x");
    clock.advance(Duration.ofSeconds(45));
    cache.set("new", "y");
    clock.advance(Duration.ofSeconds(30));

    assertEquals(1, cache.cleanup());
    assertEquals(List.of("new"), cache.stats().keys());
  }

  @Test
  void getRefreshesLastAccess() {
    cache(10, Duration.ofMinutes(1));
    cache.set("k", "v");
    Instant written = cache.lastAccessAt("k");

    clock.advance(Duration.ofSeconds(10));
    cache.get("k");

    assertEquals(written.plusSeconds(10), cache.lastAccessAt("k"));
  }

  @Test
  void statsReportNameSizeAndCapacity() {
    cache(3, Duration.ofMinutes(1));
    cache.set("x", "1");

    CacheStats stats = cache.stats();

    assertEquals("test", stats.name());
    assertEquals(1, stats.size());
    assertEquals(3, stats.maxSize());
  }

  @Test
  void deleteAndClear() {
    cache(10, Duration.ofMinutes(1));
    cache.set("a", "1");
    cache.set("b", "2");

    cache.delete("a");
    assertNull(cache.get("a"));
    assertEquals("2", cache.get("b"));

    cache.clear();
    assertEquals(0, cache.stats().size());
  }

  @Test
  void destroyClearsAndPreventsRestart() {
    cache(10, Duration.ofMinutes(1));
    cache.start();
    cache.set("a", "1");

    cache.destroy();

    assertEquals(0, cache.stats().size());
    assertThrows(IllegalStateException.class, cache::start);
  }

  @Test
  void rejectsNullValue() {
    cache(10, Duration.ofMinutes(1));
    assertThrows(NullPointerException.class, () -> cache.set("k", null));
  }

  @Test
  void builderRejectsNonPositiveSettings() {
    assertThrows(IllegalArgumentException.class,
        () -> BoundedCache.builder("x").maxSize(0).build());
    assertThrows(IllegalArgumentException.class,
        () -> BoundedCache.builder("x").ttl(Duration.ZERO).build());
    assertThrows(IllegalArgumentException.class,
        () -> BoundedCache.builder("x").cleanupInterval(Duration.ofSeconds(-1)).build());
  }
}
