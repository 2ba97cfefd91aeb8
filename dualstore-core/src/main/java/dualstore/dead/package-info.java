/**
 * Dead-letter handling for sync queue items that exhausted their retries.
 */
package dualstore.dead;
