/**
 * Replay of queued local mutations against the remote store.
 *
 * @see dualstore.sync.SyncWorker
 * @see dualstore.sync.SyncItemApplier
 */
package dualstore.sync;
