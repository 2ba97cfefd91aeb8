package dualstore.manager;

import dualstore.model.RemoteCacheStats;
import dualstore.model.StoreMode;

/**
 * Snapshot returned by {@link ResilientManager#getStats()}.
 *
 * @param mode             current mode
 * @param available        whether the manager has started and not yet shut down
 * @param remoteCacheStats remote cache counters, {@code null} unless the mode is
 *                         {@link StoreMode#REMOTE}
 * @param syncQueueSize    queue items that still have retries left, or {@code -1} if the local
 *                         store could not be asked
 */
public record ManagerStats(
    StoreMode mode,
    boolean available,
    RemoteCacheStats remoteCacheStats,
    int syncQueueSize
) {
}
