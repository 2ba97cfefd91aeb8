/**
 * TTL- and size-bounded in-memory caches used in front of the remote store.
 */
package dualstore.cache;
