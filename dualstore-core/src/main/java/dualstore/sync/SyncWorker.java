package dualstore.sync;

import dualstore.model.SyncQueueItem;
import dualstore.spi.LocalStore;
import dualstore.spi.MetricsExporter;
import dualstore.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled drainer of the local sync queue.
 *
 * <p>Each cycle pulls up to {@code batchSize} of the oldest items with retries left and hands
 * each one to a {@link SyncItemApplier}. Applied items are deleted; failed items get their
 * retry counter raised and their error stored. A failure never stops the cycle.
 *
 * <p>Unlike most schedulers the worker can be stopped and started again: the manager stops it
 * when the remote store goes away and restarts it on reconnect. An optional gate is checked
 * before every cycle so a drain never runs once the remote is known to be down.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class SyncWorker implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SyncWorker.class.getName());

  private final LocalStore localStore;
  private final SyncItemApplier applier;
  private final int batchSize;
  private final Duration interval;
  private final MetricsExporter metrics;
  private final BooleanSupplier gate;
  private final Runnable afterDrain;
  private final Object drainLock = new Object();

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> drainTask;
  private volatile boolean closed;

  private SyncWorker(Builder builder) {
    this.localStore = Objects.requireNonNull(builder.localStore, "localStore");
    this.applier = Objects.requireNonNull(builder.applier, "applier");
    this.interval = Objects.requireNonNull(builder.interval, "interval");
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("interval must be > 0");
    }
    this.batchSize = builder.batchSize;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.gate = builder.gate != null ? builder.gate : () -> true;
    this.afterDrain = builder.afterDrain;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the drain schedule. A no-op if it is already running.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("SyncWorker has been closed");
    }
    if (drainTask != null) {
      return;
    }
    if (scheduler == null) {
      scheduler = Executors.newSingleThreadScheduledExecutor(
          new DaemonThreadFactory("dualstore-sync-"));
    }
    long periodMs = interval.toMillis();
    drainTask = scheduler.scheduleWithFixedDelay(
        this::runScheduled, periodMs, periodMs, TimeUnit.MILLISECONDS);
    logger.log(Level.FINE, "Sync worker started, interval {0} ms", periodMs);
  }

  /**
   * Cancels the drain schedule. The worker can be started again.
   */
  public synchronized void stop() {
    if (drainTask != null) {
      drainTask.cancel(false);
      drainTask = null;
      logger.fine("Sync worker stopped");
    }
  }

  public boolean isRunning() {
    return drainTask != null;
  }

  /**
   * Runs one drain cycle on the calling thread. Concurrent calls are serialized.
   *
   * <p>Called by the schedule, on reconnect and at shutdown; may also be invoked directly for
   * testing.
   *
   * @return counts for this cycle
   */
  public DrainResult drain() {
    if (closed || !gate.getAsBoolean()) {
      return DrainResult.EMPTY;
    }
    synchronized (drainLock) {
      try {
        return drainBatch();
      } finally {
        notifyDrained();
      }
    }
  }

  private DrainResult drainBatch() {
    List<SyncQueueItem> items = localStore.getSyncQueue(batchSize);
    if (items.isEmpty()) {
      metrics.recordQueueDepth(0);
      return DrainResult.EMPTY;
    }
    logger.log(Level.INFO, "Syncing {0} queued operations to remote", items.size());
    int succeeded = 0;
    int failed = 0;
    for (SyncQueueItem item : items) {
      if (applyOne(item)) {
        succeeded++;
      } else {
        failed++;
      }
    }
    logger.log(Level.INFO, "Sync cycle finished: {0} applied, {1} failed",
        new Object[]{succeeded, failed});
    metrics.recordQueueDepth(localStore.countSyncQueue());
    return new DrainResult(items.size(), succeeded, failed);
  }

  private void notifyDrained() {
    if (afterDrain == null) {
      return;
    }
    try {
      afterDrain.run();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "After-drain callback failed", e);
    }
  }

  private boolean applyOne(SyncQueueItem item) {
    try {
      applier.apply(item);
    } catch (UnroutableSyncItemException e) {
      logger.log(Level.WARNING, e.getMessage());
      markFailed(item, e);
      return false;
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to sync item " + item.id()
          + " (" + item.tableName() + "/" + item.operation() + ")", e);
      markFailed(item, e);
      return false;
    }
    localStore.markSyncSuccess(item.id());
    metrics.incrementSyncSuccess();
    return true;
  }

  private void markFailed(SyncQueueItem item, Exception failure) {
    metrics.incrementSyncFailure();
    String message = failure.getMessage() != null
        ? failure.getMessage() : failure.getClass().getName();
    localStore.markSyncFailed(item.id(), message);
  }

  private void runScheduled() {
    try {
      drain();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Sync cycle failed", t);
    }
  }

  /**
   * Cancels the schedule and shuts down the worker thread.
   */
  @Override
  public synchronized void close() {
    closed = true;
    stop();
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      scheduler = null;
    }
  }

  /**
   * Outcome of one drain cycle.
   *
   * @param processed items pulled from the queue
   * @param succeeded items applied and removed
   * @param failed    items whose retry counter was raised
   */
  public record DrainResult(int processed, int succeeded, int failed) {
    public static final DrainResult EMPTY = new DrainResult(0, 0, 0);
  }

  /** Builder for {@link SyncWorker}. */
  public static final class Builder {
    private LocalStore localStore;
    private SyncItemApplier applier;
    private int batchSize = 100;
    private Duration interval = Duration.ofSeconds(60);
    private MetricsExporter metrics;
    private BooleanSupplier gate;
    private Runnable afterDrain;

    private Builder() {
    }

    /**
     * Sets the store whose queue is drained.
     *
     * <p><b>Required.</b>
     */
    public Builder localStore(LocalStore localStore) {
      this.localStore = localStore;
      return this;
    }

    /**
     * Sets the applier that replays items against the remote store.
     *
     * <p><b>Required.</b>
     */
    public Builder applier(SyncItemApplier applier) {
      this.applier = applier;
      return this;
    }

    /**
     * Sets the maximum number of items per cycle.
     *
     * <p>Optional. Defaults to {@code 100}. Must be &gt; 0.
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the delay between cycles.
     *
     * <p>Optional. Defaults to 60 seconds. Must be &gt; 0.
     */
    public Builder interval(Duration interval) {
      this.interval = interval;
      return this;
    }

    /**
     * Sets the metrics exporter for sync counters and queue depth.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets a condition checked before every cycle; the cycle is skipped when it is false.
     *
     * <p>Optional. Defaults to always true.
     */
    public Builder gate(BooleanSupplier gate) {
      this.gate = gate;
      return this;
    }

    /**
     * Sets a callback run after every drain cycle that got past the gate, whether or not it
     * found items. Exceptions from it are logged.
     *
     * <p>Optional.
     */
    public Builder afterDrain(Runnable afterDrain) {
      this.afterDrain = afterDrain;
      return this;
    }

    /**
     * Builds the worker. Call {@link SyncWorker#start()} to begin draining.
     *
     * @throws NullPointerException     if {@code localStore} or {@code applier} is null
     * @throws IllegalArgumentException if {@code batchSize} or {@code interval} is not positive
     */
    public SyncWorker build() {
      return new SyncWorker(this);
    }
  }
}
