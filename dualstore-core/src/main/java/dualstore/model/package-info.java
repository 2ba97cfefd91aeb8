/**
 * Domain rows, result types and sync queue records shared by the local and remote stores.
 *
 * @see dualstore.model.StoreMode
 * @see dualstore.model.SyncQueueItem
 */
package dualstore.model;
