package dualstore.model;

/**
 * Operation tags stored in the {@code operation} column of the sync queue.
 *
 * <p>{@link #UPDATE} carries absolute values and is idempotent on replay. {@link #ADD},
 * {@link #REMOVE} and {@link #ADD_XP} carry deltas and are not.
 */
public enum SyncOperation {
  UPDATE,
  ADD,
  REMOVE,
  ADD_XP;

  public boolean isAdditive() {
    return this != UPDATE;
  }
}
