/**
 * Dialect SPI for database-specific upsert and increment statements.
 */
package dualstore.jdbc.spi;
