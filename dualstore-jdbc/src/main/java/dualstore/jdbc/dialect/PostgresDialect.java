package dualstore.jdbc.dialect;

import dualstore.jdbc.JdbcTemplate;
import dualstore.jdbc.spi.Dialect;

import java.sql.Connection;
import java.sql.Timestamp;
import java.util.List;
import java.util.stream.Collectors;

/**
 * PostgreSQL dialect. Upserts and increments use {@code INSERT ... ON CONFLICT}.
 */
public final class PostgresDialect implements Dialect {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public String upsertSql(String table, String keyColumn, List<String> columns) {
    String updates = columns.stream()
        .map(c -> c + " = EXCLUDED." + c)
        .collect(Collectors.joining(", "));
    return "INSERT INTO " + table + " (" + keyColumn + ", " + String.join(", ", columns) + ")"
        + " VALUES (" + H2Dialect.placeholders(columns.size() + 1) + ")"
        + " ON CONFLICT (" + keyColumn + ") DO UPDATE SET " + updates;
  }

  @Override
  public long incrementAndGet(
      Connection conn, String table, String keyColumn, String column,
      String key, long delta, Timestamp now) {
    String sql = "INSERT INTO " + table + " AS t (" + keyColumn + ", " + column + ", updated_at)"
        + " VALUES (?, ?, ?)"
        + " ON CONFLICT (" + keyColumn + ") DO UPDATE SET "
        + column + " = t." + column + " + EXCLUDED." + column
        + ", updated_at = EXCLUDED.updated_at"
        + " RETURNING " + column;
    List<Long> values = JdbcTemplate.updateReturning(conn, sql, rs -> rs.getLong(1),
        key, delta, now);
    return values.get(0);
  }
}
