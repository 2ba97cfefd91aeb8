package dualstore.jdbc.spi;

import dualstore.jdbc.JdbcStoreException;
import dualstore.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.sql.Timestamp;
import java.util.List;

/**
 * SPI for database dialect support.
 *
 * <p>Implementations provide database-specific SQL for the few statements that portable SQL
 * cannot express: upserts and atomic counter increments. Register custom dialects via
 * {@code META-INF/services/dualstore.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: PostgreSQL, H2.
 *
 * @see dualstore.jdbc.dialect.Dialects
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "postgresql", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:postgresql:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * SQL that inserts a row or, when {@code keyColumn} already exists, overwrites only the
   * listed columns. Columns not listed keep their value or take their default on insert.
   *
   * <p>Parameters: the key, then one value per entry of {@code columns}, in order.
   */
  String upsertSql(String table, String keyColumn, List<String> columns);

  /**
   * Trivial query used for health probes.
   */
  default String probeSql() {
    return "SELECT 1";
  }

  /**
   * Adds {@code delta} to a numeric column, creating the row when missing, and returns the new
   * value. Must run inside the caller's transaction.
   *
   * <p>Default implementation issues an UPDATE, an INSERT when nothing was updated, then a
   * SELECT. A duplicate-key failure of the INSERT is retried once as an UPDATE, which needs a
   * database that keeps the transaction usable after a failed statement (H2 does). Dialects
   * with an atomic upsert override it.
   */
  default long incrementAndGet(
      Connection conn, String table, String keyColumn, String column,
      String key, long delta, Timestamp now) {
    String updateSql = "UPDATE " + table + " SET " + column + " = " + column + " + ?,"
        + " updated_at = ? WHERE " + keyColumn + " = ?";
    if (JdbcTemplate.update(conn, updateSql, delta, now, key) == 0) {
      try {
        JdbcTemplate.update(conn,
            "INSERT INTO " + table + " (" + keyColumn + ", " + column + ", updated_at)"
                + " VALUES (?, ?, ?)",
            key, delta, now);
      } catch (JdbcStoreException e) {
        // lost an insert race; the row exists now
        if (JdbcTemplate.update(conn, updateSql, delta, now, key) == 0) {
          throw e;
        }
      }
    }
    return JdbcTemplate.queryOne(conn,
            "SELECT " + column + " FROM " + table + " WHERE " + keyColumn + " = ?",
            rs -> rs.getLong(1), key)
        .orElseThrow(() -> new IllegalStateException(
            "Row vanished after increment: " + table + "." + key));
  }
}
