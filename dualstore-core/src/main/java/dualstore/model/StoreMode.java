package dualstore.model;

/**
 * The manager's current belief about which store is authoritative.
 */
public enum StoreMode {
  /** Before {@code start()} has decided. */
  UNKNOWN("unknown"),
  /** Remote store switched off by configuration; terminal for the process lifetime. */
  DISABLED("disabled"),
  /** Remote unreachable; the local store is the source of truth and writes are queued. */
  LOCAL("local"),
  /** Remote reachable and authoritative. */
  REMOTE("remote");

  private final String label;

  StoreMode(String label) {
    this.label = label;
  }

  /**
   * Lower-case label used in stats output and logs.
   */
  public String label() {
    return label;
  }
}
