/**
 * The resilient data manager: mode state machine, write-through protocol, health checks and
 * reconnects.
 *
 * @see dualstore.manager.ResilientManager
 */
package dualstore.manager;
