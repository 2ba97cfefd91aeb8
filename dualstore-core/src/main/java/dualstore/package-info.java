/**
 * Dual-store persistence that keeps serving reads and writes while the remote database is
 * unreachable and reconciles through a durable change queue once it is back.
 *
 * @see dualstore.manager.ResilientManager
 * @see dualstore.spi.LocalStore
 * @see dualstore.spi.RemoteStore
 */
package dualstore;
