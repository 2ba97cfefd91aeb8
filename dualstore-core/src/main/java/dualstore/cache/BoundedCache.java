package dualstore.cache;

import dualstore.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-memory key/value cache with a TTL per entry and a hard capacity.
 *
 * <p>Eviction is <b>FIFO</b>: when the cache is full and a new key arrives, the entry that was
 * inserted first is dropped, even if it was read a moment ago. The last access time is kept on
 * each entry for diagnostics only. Overwriting an existing key keeps its insertion position.
 *
 * <p>Expired entries are removed lazily by {@link #get} and proactively by {@link #cleanup()},
 * which runs on a daemon thread every {@code cleanupInterval} once {@link #start()} is called.
 * Call {@link #destroy()} on shutdown to stop the sweeper.
 *
 * <p>This class is thread-safe.
 *
 * @param <V> value type
 */
public final class BoundedCache<V> implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(BoundedCache.class.getName());

  private final String name;
  private final Duration ttl;
  private final int maxSize;
  private final Duration cleanupInterval;
  private final Clock clock;
  private final LinkedHashMap<String, Entry<V>> entries = new LinkedHashMap<>();

  private ScheduledExecutorService scheduler;
  private ScheduledFuture<?> cleanupTask;
  private boolean destroyed;

  private BoundedCache(Builder builder) {
    this.name = Objects.requireNonNull(builder.name, "name");
    this.ttl = Objects.requireNonNull(builder.ttl, "ttl");
    this.cleanupInterval = Objects.requireNonNull(builder.cleanupInterval, "cleanupInterval");
    this.clock = Objects.requireNonNull(builder.clock, "clock");
    if (ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("ttl must be > 0");
    }
    if (builder.maxSize <= 0) {
      throw new IllegalArgumentException("maxSize must be > 0");
    }
    if (cleanupInterval.isNegative() || cleanupInterval.isZero()) {
      throw new IllegalArgumentException("cleanupInterval must be > 0");
    }
    this.maxSize = builder.maxSize;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public String name() {
    return name;
  }

  /**
   * Starts the periodic sweep. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (destroyed) {
      throw new IllegalStateException("BoundedCache '" + name + "' has been destroyed");
    }
    if (cleanupTask != null) {
      return;
    }
    long periodMs = cleanupInterval.toMillis();
    scheduler = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("dualstore-cache-" + name + "-"));
    cleanupTask = scheduler.scheduleWithFixedDelay(
        this::runCleanup, periodMs, periodMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Stores a value with the default TTL.
   */
  public void set(String key, V value) {
    set(key, value, null);
  }

  /**
   * Stores a value. When the cache is full and {@code key} is new, the oldest-inserted entry
   * is evicted first.
   *
   * @param key   cache key
   * @param value value to cache, never {@code null}
   * @param ttl   entry TTL, or {@code null} for the cache default
   */
  public synchronized void set(String key, V value, Duration ttl) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    if (!entries.containsKey(key) && entries.size() >= maxSize) {
      Iterator<String> oldest = entries.keySet().iterator();
      oldest.next();
      oldest.remove();
    }
    Instant now = clock.instant();
    Duration effectiveTtl = ttl != null ? ttl : this.ttl;
    entries.put(key, new Entry<>(value, now.plus(effectiveTtl), now));
  }

  /**
   * Returns the cached value, or {@code null} if absent or expired. Expired entries are
   * removed on the way out.
   */
  public synchronized V get(String key) {
    Entry<V> entry = entries.get(key);
    if (entry == null) {
      return null;
    }
    Instant now = clock.instant();
    if (now.isAfter(entry.expiresAt)) {
      entries.remove(key);
      return null;
    }
    entry.lastAccessAt = now;
    return entry.value;
  }

  public synchronized void delete(String key) {
    entries.remove(key);
  }

  public synchronized void clear() {
    entries.clear();
  }

  /**
   * Removes every expired entry.
   *
   * @return number of entries removed
   */
  public synchronized int cleanup() {
    Instant now = clock.instant();
    int removed = 0;
    Iterator<Map.Entry<String, Entry<V>>> it = entries.entrySet().iterator();
    while (it.hasNext()) {
      if (now.isAfter(it.next().getValue().expiresAt)) {
        it.remove();
        removed++;
      }
    }
    return removed;
  }

  public synchronized CacheStats stats() {
    return new CacheStats(name, entries.size(), maxSize, new ArrayList<>(entries.keySet()));
  }

  /**
   * Returns when {@code key} was last read or written, or {@code null} if absent.
   */
  public synchronized Instant lastAccessAt(String key) {
    Entry<V> entry = entries.get(key);
    return entry == null ? null : entry.lastAccessAt;
  }

  /**
   * Cancels the sweeper and drops every entry. The cache cannot be restarted afterwards.
   */
  public synchronized void destroy() {
    destroyed = true;
    if (cleanupTask != null) {
      cleanupTask.cancel(false);
      cleanupTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      scheduler = null;
    }
    entries.clear();
  }

  @Override
  public void close() {
    destroy();
  }

  private void runCleanup() {
    try {
      int removed = cleanup();
      if (removed > 0) {
        logger.log(Level.FINE, "Cache {0} cleanup: {1} expired entries removed",
            new Object[]{name, removed});
      }
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Cache cleanup failed for " + name, t);
    }
  }

  private static final class Entry<V> {
    final V value;
    final Instant expiresAt;
    Instant lastAccessAt;

    Entry(V value, Instant expiresAt, Instant lastAccessAt) {
      this.value = value;
      this.expiresAt = expiresAt;
      this.lastAccessAt = lastAccessAt;
    }
  }

  /** Builder for {@link BoundedCache}. */
  public static final class Builder {
    private final String name;
    private Duration ttl = Duration.ofMinutes(30);
    private int maxSize = 1000;
    private Duration cleanupInterval = Duration.ofMinutes(5);
    private Clock clock = Clock.systemUTC();

    private Builder(String name) {
      this.name = name;
    }

    /**
     * Sets the default entry TTL.
     *
     * <p>Optional. Defaults to 30 minutes. Must be &gt; 0.
     */
    public Builder ttl(Duration ttl) {
      this.ttl = ttl;
      return this;
    }

    /**
     * Sets the capacity.
     *
     * <p>Optional. Defaults to {@code 1000}. Must be &gt; 0.
     */
    public Builder maxSize(int maxSize) {
      this.maxSize = maxSize;
      return this;
    }

    /**
     * Sets how often expired entries are swept.
     *
     * <p>Optional. Defaults to 5 minutes. Must be &gt; 0.
     */
    public Builder cleanupInterval(Duration cleanupInterval) {
      this.cleanupInterval = cleanupInterval;
      return this;
    }

    /**
     * Sets the clock used for expiry. Tests pass a controllable clock.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Builds the cache. Call {@link BoundedCache#start()} to begin periodic sweeping.
     *
     * @throws NullPointerException     if a required value is null
     * @throws IllegalArgumentException if {@code ttl}, {@code maxSize} or
     *                                  {@code cleanupInterval} is not positive
     */
    public <V> BoundedCache<V> build() {
      return new BoundedCache<>(this);
    }
  }
}
