/**
 * Embedded file-backed local store with the persistent sync queue.
 *
 * @see dualstore.jdbc.local.DurableLocalStore
 */
package dualstore.jdbc.local;
