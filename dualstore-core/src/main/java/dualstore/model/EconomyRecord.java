package dualstore.model;

import java.time.Instant;

/**
 * Balance row. Changed only through additions and guarded withdrawals.
 */
public record EconomyRecord(String userId, long balance, Instant updatedAt) {
}
