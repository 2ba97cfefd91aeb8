package dualstore.util;

/**
 * Thrown by {@link TimeLimiter} when a deadline-bounded call fails or runs out of time.
 */
public class RemoteCallException extends RuntimeException {
  private final boolean timedOut;

  public RemoteCallException(String message, boolean timedOut, Throwable cause) {
    super(message, cause);
    this.timedOut = timedOut;
  }

  /**
   * Whether the call was abandoned because its deadline passed. The underlying operation
   * may still have completed on the remote side.
   */
  public boolean isTimedOut() {
    return timedOut;
  }
}
