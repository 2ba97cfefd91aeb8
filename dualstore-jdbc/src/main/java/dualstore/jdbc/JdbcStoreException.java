package dualstore.jdbc;

/**
 * Unchecked exception wrapping JDBC errors raised through {@link JdbcTemplate}.
 *
 * @see LocalStoreException
 * @see RemoteStoreException
 */
public class JdbcStoreException extends RuntimeException {
  public JdbcStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
