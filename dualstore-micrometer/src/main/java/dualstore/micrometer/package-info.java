/**
 * Micrometer bridge for exporting dualstore metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link dualstore.micrometer.MicrometerMetricsExporter} implements the
 * {@link dualstore.spi.MetricsExporter} SPI using Micrometer counters and gauges.
 *
 * @see dualstore.micrometer.MicrometerMetricsExporter
 */
package dualstore.micrometer;
