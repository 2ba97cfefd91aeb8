package dualstore.model;

import java.time.Instant;

/**
 * A queued local mutation waiting to be applied to the remote store.
 *
 * @param id          row id, ascending with insertion
 * @param tableName   target table, see {@link SyncTable}
 * @param operation   operation tag, see {@link SyncOperation}
 * @param payloadJson flat JSON object with the mutation's arguments
 * @param createdAt   enqueue time
 * @param retries     failed replay attempts so far
 * @param lastError   message of the last failed attempt, or {@code null}
 */
public record SyncQueueItem(
    long id,
    String tableName,
    String operation,
    String payloadJson,
    Instant createdAt,
    int retries,
    String lastError
) {
}
