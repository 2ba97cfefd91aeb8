/**
 * Built-in {@link dualstore.jdbc.spi.Dialect} implementations and the
 * {@link dualstore.jdbc.dialect.Dialects} registry.
 */
package dualstore.jdbc.dialect;
