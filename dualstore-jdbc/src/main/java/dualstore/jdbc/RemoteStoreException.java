package dualstore.jdbc;

/**
 * A statement against the remote store failed. The manager turns these into a local fallback
 * read or a queued write.
 */
public final class RemoteStoreException extends JdbcStoreException {
  public RemoteStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
