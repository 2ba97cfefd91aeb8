/**
 * JDBC infrastructure shared by the local and remote stores.
 *
 * <p>{@link dualstore.jdbc.JdbcTemplate} provides lightweight JDBC helpers and
 * {@link dualstore.jdbc.SchemaScripts} runs the bundled schema scripts. Statement failures
 * surface as {@link dualstore.jdbc.LocalStoreException} or
 * {@link dualstore.jdbc.RemoteStoreException}.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code dualstore.jdbc.local}: the embedded H2 {@link dualstore.spi.LocalStore}</li>
 *   <li>{@code dualstore.jdbc.remote}: the cached {@link dualstore.spi.RemoteStore}</li>
 *   <li>{@code dualstore.jdbc.dialect}: built-in dialects and detection</li>
 * </ul>
 *
 * @see dualstore.jdbc.JdbcTemplate
 */
package dualstore.jdbc;
