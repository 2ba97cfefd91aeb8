package dualstore;

/**
 * The local store could not be opened or its schema could not be created.
 *
 * <p>Fatal: the manager cannot run without its local copy, so this is raised before any
 * contact with the remote store.
 */
public class StoreInitializationException extends RuntimeException {

  public StoreInitializationException(String message, Throwable cause) {
    super(message, cause);
  }
}
