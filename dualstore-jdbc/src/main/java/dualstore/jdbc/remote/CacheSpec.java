package dualstore.jdbc.remote;

import java.time.Duration;
import java.util.Objects;

/**
 * TTL and capacity of one read-through cache family.
 */
public record CacheSpec(Duration ttl, int maxSize) {

  public static final CacheSpec GUILD_SETTINGS_DEFAULT =
      new CacheSpec(Duration.ofMinutes(30), 500);
  public static final CacheSpec USER_SETTINGS_DEFAULT =
      new CacheSpec(Duration.ofMinutes(30), 1000);
  public static final CacheSpec ECONOMY_DEFAULT =
      new CacheSpec(Duration.ofMinutes(10), 2000);
  public static final CacheSpec LEVELS_DEFAULT =
      new CacheSpec(Duration.ofMinutes(5), 2000);

  public CacheSpec {
    Objects.requireNonNull(ttl, "ttl");
    if (ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("ttl must be > 0");
    }
    if (maxSize <= 0) {
      throw new IllegalArgumentException("maxSize must be > 0");
    }
  }
}
