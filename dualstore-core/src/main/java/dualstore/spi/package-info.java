/**
 * Service provider interfaces for pluggable stores and metrics.
 *
 * <p>{@link dualstore.spi.LocalStore} and {@link dualstore.spi.RemoteStore} are the two sides
 * the manager arbitrates between. {@link dualstore.spi.MetricsExporter} exports counters.
 */
package dualstore.spi;
