package dualstore.cache;

import java.util.List;

/**
 * Point-in-time view of a {@link BoundedCache}, meant for debug commands and logs.
 *
 * @param name    the cache family name
 * @param size    current number of entries (expired entries not yet swept included)
 * @param maxSize configured capacity
 * @param keys    snapshot of the keys in insertion order
 */
public record CacheStats(String name, int size, int maxSize, List<String> keys) {

  public CacheStats {
    keys = List.copyOf(keys);
  }
}
