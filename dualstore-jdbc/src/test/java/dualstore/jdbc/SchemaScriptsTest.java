package dualstore.jdbc;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchemaScriptsTest {

  @Test
  void localScriptCreatesEveryTableAndTheQueueIndex() throws IOException {
    List<String> statements = SchemaScripts.load(SchemaScripts.H2);

    assertTrue(statements.stream().anyMatch(s -> s.contains("CREATE TABLE IF NOT EXISTS sync_queue")));
    for (String table : List.of("guild_settings", "user_settings", "economy", "levels")) {
      assertTrue(statements.stream().anyMatch(s -> s.contains("EXISTS " + table + " (")), table);
    }
    assertTrue(statements.stream().anyMatch(s -> s.contains("idx_sync_queue_created_at")));
    assertTrue(statements.stream().noneMatch(s -> s.startsWith("--")));
  }

  @Test
  void remoteScriptHasNoSyncQueue() throws IOException {
    List<String> statements = SchemaScripts.load(SchemaScripts.POSTGRESQL);

    assertEquals(4, statements.size());
    assertTrue(statements.stream().noneMatch(s -> s.contains("sync_queue")));
  }

  @Test
  void localScriptParsesIntoCreateStatementsOnly() throws IOException {
    List<String> statements = SchemaScripts.load(SchemaScripts.H2);

    assertEquals(7, statements.size());
    for (String sql : statements) {
      assertTrue(sql.startsWith("CREATE TABLE IF NOT EXISTS ")
          || sql.startsWith("CREATE INDEX IF NOT EXISTS "), sql);
    }
    String queue = statements.stream()
        .filter(s -> s.contains("EXISTS sync_queue ("))
        .findFirst()
        .orElseThrow();
    assertTrue(queue.contains("data VARCHAR"), queue);
  }

  @Test
  void remoteScriptParsesIntoCreateStatementsOnly() throws IOException {
    for (String sql : SchemaScripts.load(SchemaScripts.POSTGRESQL)) {
      assertTrue(sql.startsWith("CREATE TABLE IF NOT EXISTS "), sql);
    }
  }

  @Test
  void semicolonInCommentDoesNotSplitStatement() {
    String script = "-- first; second\n"
        + "CREATE TABLE a (id INT);\r\n"
        + "  -- trailing; note\n"
        + "CREATE TABLE b (id INT);\n";

    assertEquals(List.of("CREATE TABLE a (id INT)", "CREATE TABLE b (id INT)"),
        SchemaScripts.parse(script));
  }

  @Test
  void bundledScriptsRunOnH2() throws Exception {
    try (Connection conn = DriverManager.getConnection("jdbc:h2:mem:schema_scripts_test")) {
      SchemaScripts.apply(conn, SchemaScripts.H2);
      // idempotent
      SchemaScripts.apply(conn, SchemaScripts.H2);
      try (Statement st = conn.createStatement();
           ResultSet rs = st.executeQuery("SELECT COUNT(data) FROM sync_queue")) {
        assertTrue(rs.next());
        assertEquals(0, rs.getInt(1));
      }
    }
  }

  @Test
  void missingResourceFails() {
    assertThrows(IOException.class, () -> SchemaScripts.load("dualstore/schema/none.sql"));
  }
}
