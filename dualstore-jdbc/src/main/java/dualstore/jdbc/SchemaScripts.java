package dualstore.jdbc;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the bundled schema scripts and runs them statement by statement.
 *
 * <p>Full-line {@code --} comments are removed first, so they may contain anything. The rest
 * is split on {@code ;}, which must not appear inside literals.
 */
public final class SchemaScripts {
  /** Embedded local store schema, tables and sync queue. */
  public static final String H2 = "dualstore/schema/h2.sql";
  /** Remote store schema for PostgreSQL. */
  public static final String POSTGRESQL = "dualstore/schema/postgresql.sql";

  private SchemaScripts() {}

  /**
   * Reads a classpath resource into separate statements. Full-line {@code --} comments are
   * removed before the script is split on {@code ;}, so a comment may contain a separator.
   *
   * @throws IOException if the resource is missing or unreadable
   */
  public static List<String> load(String resource) throws IOException {
    try (InputStream is = SchemaScripts.class.getClassLoader().getResourceAsStream(resource)) {
      if (is == null) {
        throw new IOException("Resource not found: " + resource);
      }
      return parse(new String(is.readAllBytes(), StandardCharsets.UTF_8));
    }
  }

  static List<String> parse(String script) {
    List<String> statements = new ArrayList<>();
    for (String stmt : stripComments(script).split(";")) {
      String trimmed = stmt.trim();
      if (!trimmed.isEmpty()) {
        statements.add(trimmed);
      }
    }
    return statements;
  }

  /**
   * Runs every statement of {@code resource} on {@code conn}.
   */
  public static void apply(Connection conn, String resource) throws IOException, SQLException {
    try (Statement st = conn.createStatement()) {
      for (String sql : load(resource)) {
        st.execute(sql);
      }
    }
  }

  private static String stripComments(String script) {
    StringBuilder sb = new StringBuilder();
    for (String line : script.split("\r?\n")) {
      if (!line.trim().startsWith("--")) {
        sb.append(line).append('\n');
      }
    }
    return sb.toString();
  }
}
