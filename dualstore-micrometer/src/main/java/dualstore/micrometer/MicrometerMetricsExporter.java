package dualstore.micrometer;

import dualstore.model.StoreMode;
import dualstore.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and gauges with a {@link MeterRegistry} for export to Prometheus,
 * Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code dualstore.cache.hits}, tag {@code family}: remote reads answered from a cache</li>
 *   <li>{@code dualstore.cache.misses}, tag {@code family}: remote reads that hit the database</li>
 *   <li>{@code dualstore.remote.read.fallback}: remote reads answered locally instead</li>
 *   <li>{@code dualstore.remote.write.failure}: direct remote writes that failed</li>
 *   <li>{@code dualstore.sync.success}: queue items applied to the remote</li>
 *   <li>{@code dualstore.sync.failure}: queue items that failed (will retry)</li>
 *   <li>{@code dualstore.queue.purged}: queue rows deleted by the purge</li>
 *   <li>{@code dualstore.mode.transitions}, tags {@code from}, {@code to}</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code dualstore.queue.depth}: drainable items after the last drain</li>
 *   <li>{@code dualstore.mode}, tag {@code mode}: {@code 1} for the current mode, {@code 0}
 *       for the others</li>
 * </ul>
 *
 * <p>Tagged counters are registered the first time their tag value is seen.
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Counter readFallback;
  private final Counter writeFailure;
  private final Counter syncSuccess;
  private final Counter syncFailure;
  private final Counter queuePurged;
  private final Gauge queueDepthGauge;
  private final List<Gauge> modeGauges = new ArrayList<>();
  private final Map<String, Counter> taggedCounters = new ConcurrentHashMap<>();

  private final AtomicInteger queueDepth = new AtomicInteger();
  private final AtomicReference<StoreMode> currentMode =
      new AtomicReference<>(StoreMode.UNKNOWN);
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "dualstore"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "dualstore");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "bot.dualstore"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.namePrefix = namePrefix;
    this.readFallback = Counter.builder(namePrefix + ".remote.read.fallback")
        .description("Remote reads answered from the local store")
        .register(registry);
    this.writeFailure = Counter.builder(namePrefix + ".remote.write.failure")
        .description("Direct remote writes that failed or timed out")
        .register(registry);
    this.syncSuccess = Counter.builder(namePrefix + ".sync.success")
        .description("Queued operations applied to the remote store")
        .register(registry);
    this.syncFailure = Counter.builder(namePrefix + ".sync.failure")
        .description("Queued operations that failed (will retry)")
        .register(registry);
    this.queuePurged = Counter.builder(namePrefix + ".queue.purged")
        .description("Sync queue rows deleted by the purge")
        .register(registry);

    this.queueDepthGauge = Gauge.builder(namePrefix + ".queue.depth", queueDepth,
            AtomicInteger::get)
        .description("Drainable sync queue items")
        .register(registry);
    Map<StoreMode, Gauge> byMode = new EnumMap<>(StoreMode.class);
    for (StoreMode mode : StoreMode.values()) {
      byMode.put(mode, Gauge.builder(namePrefix + ".mode", currentMode,
              ref -> ref.get() == mode ? 1.0 : 0.0)
          .tag("mode", mode.label())
          .description("1 for the current store mode")
          .register(registry));
    }
    modeGauges.addAll(byMode.values());
  }

  @Override
  public void incrementCacheHit(String family) {
    if (closed) return;
    tagged("cache.hits", "Remote reads answered from a cache", "family", family).increment();
  }

  @Override
  public void incrementCacheMiss(String family) {
    if (closed) return;
    tagged("cache.misses", "Remote reads that went to the database", "family", family)
        .increment();
  }

  @Override
  public void incrementRemoteReadFallback() {
    if (closed) return;
    readFallback.increment();
  }

  @Override
  public void incrementRemoteWriteFailure() {
    if (closed) return;
    writeFailure.increment();
  }

  @Override
  public void incrementSyncSuccess() {
    if (closed) return;
    syncSuccess.increment();
  }

  @Override
  public void incrementSyncFailure() {
    if (closed) return;
    syncFailure.increment();
  }

  @Override
  public void recordModeTransition(StoreMode from, StoreMode to) {
    if (closed) return;
    currentMode.set(to);
    String key = "mode.transitions|" + from.label() + "|" + to.label();
    taggedCounters.computeIfAbsent(key, k -> Counter.builder(namePrefix + ".mode.transitions")
            .description("Store mode changes")
            .tag("from", from.label())
            .tag("to", to.label())
            .register(registry))
        .increment();
  }

  @Override
  public void recordQueueDepth(int depth) {
    if (closed) return;
    queueDepth.set(depth);
  }

  @Override
  public void incrementQueuePurged(int count) {
    if (closed) return;
    queuePurged.increment(count);
  }

  private Counter tagged(String name, String description, String tagKey, String tagValue) {
    return taggedCounters.computeIfAbsent(name + "|" + tagValue,
        k -> Counter.builder(namePrefix + "." + name)
            .description(description)
            .tag(tagKey, tagValue)
            .register(registry));
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the manager is shut down to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(readFallback, writeFailure, syncSuccess,
        syncFailure, queuePurged, queueDepthGauge));
    meters.addAll(modeGauges);
    meters.addAll(taggedCounters.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
