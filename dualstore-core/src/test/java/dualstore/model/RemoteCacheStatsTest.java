package dualstore.model;

import dualstore.cache.CacheStats;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RemoteCacheStatsTest {

  @Test
  void familiesKeepTheOrderTheyWereGivenIn() {
    Map<String, CacheStats> caches = new LinkedHashMap<>();
    for (String family : List.of("guildSettings", "userSettings", "economy", "levels")) {
      caches.put(family, new CacheStats(family, 0, 10, List.of()));
    }

    RemoteCacheStats stats = RemoteCacheStats.of(3, 1, caches);
    caches.clear();

    assertEquals(List.of("guildSettings", "userSettings", "economy", "levels"),
        List.copyOf(stats.caches().keySet()));
    assertThrows(UnsupportedOperationException.class,
        () -> stats.caches().remove("levels"));
    assertEquals(4, stats.total());
    assertEquals(75.0, stats.hitRate(), 0.001);
  }

  @Test
  void hitRateIsZeroBeforeAnyRead() {
    assertEquals(0.0, RemoteCacheStats.of(0, 0, Map.of()).hitRate());
  }
}
