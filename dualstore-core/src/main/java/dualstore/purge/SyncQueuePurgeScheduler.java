package dualstore.purge;

import dualstore.spi.LocalStore;
import dualstore.spi.MetricsExporter;
import dualstore.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled reaper for the local sync queue: deletes items older than the retention period
 * and items that ran out of retries.
 *
 * <p>Each cycle deletes in batches (default 500) until a batch comes back short, then sleeps
 * until the next interval (default one hour).
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class SyncQueuePurgeScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SyncQueuePurgeScheduler.class.getName());

  private final LocalStore localStore;
  private final Duration retention;
  private final int batchSize;
  private final Duration interval;
  private final Clock clock;
  private final MetricsExporter metrics;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> purgeTask;
  private volatile boolean closed;

  private SyncQueuePurgeScheduler(Builder builder) {
    this.localStore = Objects.requireNonNull(builder.localStore, "localStore");
    this.interval = Objects.requireNonNull(builder.interval, "interval");
    this.clock = Objects.requireNonNull(builder.clock, "clock");

    if (builder.retention != null && builder.retention.isNegative()) {
      throw new IllegalArgumentException("retention must be >= 0");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("interval must be > 0");
    }

    this.retention = builder.retention != null ? builder.retention : Duration.ofDays(7);
    this.batchSize = builder.batchSize;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled purge loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("SyncQueuePurgeScheduler has been closed");
    }
    if (purgeTask != null) {
      return;
    }
    long periodMs = interval.toMillis();
    scheduler = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("dualstore-purge-"));
    purgeTask = scheduler.scheduleWithFixedDelay(
        this::runOnce, periodMs, periodMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Executes one purge cycle.
   *
   * <p>May be invoked directly for testing or one-off purges.
   *
   * @return number of queue rows deleted
   */
  public long runOnce() {
    if (closed) {
      return 0;
    }
    try {
      Instant cutoff = clock.instant().minus(retention);
      long totalDeleted = 0;
      int deleted;
      do {
        deleted = localStore.clearOldSyncQueue(cutoff, batchSize);
        totalDeleted += deleted;
      } while (deleted >= batchSize);
      if (totalDeleted > 0) {
        metrics.incrementQueuePurged((int) Math.min(Integer.MAX_VALUE, totalDeleted));
        logger.log(Level.INFO, "Purged {0} sync queue items older than {1} or out of retries",
            new Object[]{totalDeleted, cutoff});
      }
      return totalDeleted;
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Sync queue purge failed", t);
      return 0;
    }
  }

  /** Cancels the purge schedule and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (purgeTask != null) {
      purgeTask.cancel(false);
      purgeTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link SyncQueuePurgeScheduler}. */
  public static final class Builder {
    private LocalStore localStore;
    private Duration retention;
    private int batchSize = 500;
    private Duration interval = Duration.ofHours(1);
    private Clock clock = Clock.systemUTC();
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the store whose queue is purged.
     *
     * <p><b>Required.</b>
     */
    public Builder localStore(LocalStore localStore) {
      this.localStore = localStore;
      return this;
    }

    /**
     * Sets the retention period. Queue items older than this are deleted whether or not they
     * were applied.
     *
     * <p>Optional. Defaults to {@code 7 days}. Must be &ge; 0.
     */
    public Builder retention(Duration retention) {
      this.retention = retention;
      return this;
    }

    /**
     * Sets the maximum number of rows deleted per statement.
     *
     * <p>Optional. Defaults to {@code 500}. Must be &gt; 0.
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the delay between purge cycles.
     *
     * <p>Optional. Defaults to 1 hour. Must be &gt; 0.
     */
    public Builder interval(Duration interval) {
      this.interval = interval;
      return this;
    }

    /**
     * Sets the clock used to compute the cutoff.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Builds the purge scheduler. Call {@link SyncQueuePurgeScheduler#start()} to begin.
     *
     * @throws NullPointerException     if {@code localStore} is null
     * @throws IllegalArgumentException if {@code retention} is negative,
     *     {@code batchSize <= 0}, or {@code interval} is not positive
     */
    public SyncQueuePurgeScheduler build() {
      return new SyncQueuePurgeScheduler(this);
    }
  }
}
