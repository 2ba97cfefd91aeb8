package dualstore.jdbc;

/**
 * A statement against the embedded local store failed. Propagates to the caller of the
 * manager, since the local write is the one that must not be lost.
 */
public final class LocalStoreException extends JdbcStoreException {
  public LocalStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
