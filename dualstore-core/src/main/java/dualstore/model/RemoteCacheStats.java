package dualstore.model;

import dualstore.cache.CacheStats;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hit/miss counters of the remote store's read-through caches.
 *
 * @param hits    reads answered from a cache
 * @param misses  reads that went to the database
 * @param total   {@code hits + misses}
 * @param hitRate {@code hits / total} in percent, {@code 0} when nothing was read yet
 * @param caches  per-family cache snapshots keyed by family name, in the order given
 */
public record RemoteCacheStats(
    long hits,
    long misses,
    long total,
    double hitRate,
    Map<String, CacheStats> caches
) {

  public RemoteCacheStats {
    caches = Collections.unmodifiableMap(new LinkedHashMap<>(caches));
  }

  public static RemoteCacheStats of(long hits, long misses, Map<String, CacheStats> caches) {
    long total = hits + misses;
    double rate = total == 0 ? 0.0 : hits * 100.0 / total;
    return new RemoteCacheStats(hits, misses, total, rate, caches);
  }
}
