package dualstore.spi;

import dualstore.model.StoreMode;

/**
 * Observability hook for exporting manager and cache counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards everything. Implement this interface to bridge into
 * Micrometer or another monitoring system.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * A remote read was answered from the named cache family.
   */
  void incrementCacheHit(String family);

  /**
   * A remote read missed the named cache family and went to the database.
   */
  void incrementCacheMiss(String family);

  /**
   * A remote read failed or timed out and the local copy was returned instead.
   */
  void incrementRemoteReadFallback();

  /**
   * A direct remote write failed or timed out.
   */
  void incrementRemoteWriteFailure();

  /**
   * A queued item was applied to the remote store.
   */
  void incrementSyncSuccess();

  /**
   * A queued item failed to apply and had its retry counter raised.
   */
  void incrementSyncFailure();

  /**
   * The manager moved from one mode to another.
   */
  void recordModeTransition(StoreMode from, StoreMode to);

  /**
   * Number of drainable items in the sync queue, sampled after each drain.
   */
  void recordQueueDepth(int depth);

  /**
   * Number of queue rows deleted by a purge run.
   */
  default void incrementQueuePurged(int count) {
  }

  /**
   * Default no-op implementation.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementCacheHit(String family) {
    }

    @Override
    public void incrementCacheMiss(String family) {
    }

    @Override
    public void incrementRemoteReadFallback() {
    }

    @Override
    public void incrementRemoteWriteFailure() {
    }

    @Override
    public void incrementSyncSuccess() {
    }

    @Override
    public void incrementSyncFailure() {
    }

    @Override
    public void recordModeTransition(StoreMode from, StoreMode to) {
    }

    @Override
    public void recordQueueDepth(int depth) {
    }
  }
}
