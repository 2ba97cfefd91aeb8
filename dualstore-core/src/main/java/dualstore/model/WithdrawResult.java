package dualstore.model;

/**
 * Result of a guarded withdrawal. On failure {@code balance} is the unchanged balance.
 */
public record WithdrawResult(boolean success, long balance) {
}
