/**
 * Periodic reaping of old and exhausted sync queue items.
 *
 * @see dualstore.purge.SyncQueuePurgeScheduler
 */
package dualstore.purge;
