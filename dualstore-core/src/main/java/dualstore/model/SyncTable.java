package dualstore.model;

/**
 * Tables that may appear in the {@code table_name} column of the sync queue.
 */
public enum SyncTable {
  GUILD_SETTINGS("guild_settings"),
  USER_SETTINGS("user_settings"),
  ECONOMY("economy"),
  LEVELS("levels");

  private final String tableName;

  SyncTable(String tableName) {
    this.tableName = tableName;
  }

  public String tableName() {
    return tableName;
  }

  /**
   * Resolves a stored table name.
   *
   * @throws IllegalArgumentException if the name is not a known table
   */
  public static SyncTable fromTableName(String tableName) {
    for (SyncTable table : values()) {
      if (table.tableName.equals(tableName)) {
        return table;
      }
    }
    throw new IllegalArgumentException("Unknown sync table: " + tableName);
  }
}
