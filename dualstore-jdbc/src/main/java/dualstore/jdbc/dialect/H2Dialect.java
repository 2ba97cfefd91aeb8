package dualstore.jdbc.dialect;

import dualstore.jdbc.spi.Dialect;

import java.util.Collections;
import java.util.List;

/**
 * H2 dialect. Used by the embedded local store and by tests that stand in for the remote.
 */
public final class H2Dialect implements Dialect {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public String upsertSql(String table, String keyColumn, List<String> columns) {
    return "MERGE INTO " + table + " (" + keyColumn + ", " + String.join(", ", columns) + ")"
        + " KEY (" + keyColumn + ") VALUES (" + placeholders(columns.size() + 1) + ")";
  }

  static String placeholders(int count) {
    return String.join(", ", Collections.nCopies(count, "?"));
  }
}
