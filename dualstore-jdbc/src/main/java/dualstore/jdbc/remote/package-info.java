/**
 * Remote store accessor with per-family read-through caches and a bounded health probe.
 *
 * @see dualstore.jdbc.remote.CachedRemoteStore
 */
package dualstore.jdbc.remote;
