package dualstore.sync;

/**
 * A queue item whose table, operation or payload does not map to any remote operation.
 *
 * <p>The item is marked failed like any other failure and ends up as a dead letter once its
 * retries run out.
 */
public class UnroutableSyncItemException extends Exception {

  public UnroutableSyncItemException(String message) {
    super(message);
  }

  public UnroutableSyncItemException(String message, Throwable cause) {
    super(message, cause);
  }
}
