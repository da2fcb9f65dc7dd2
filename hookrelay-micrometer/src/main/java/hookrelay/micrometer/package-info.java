/**
 * Micrometer bridge for exporting webhook delivery metrics to Prometheus, Grafana and
 * other backends.
 *
 * <p>{@link hookrelay.micrometer.MicrometerMetricsExporter} implements the
 * {@link hookrelay.spi.MetricsExporter} SPI with Micrometer counters, a gauge and a
 * distribution summary.
 *
 * @see hookrelay.micrometer.MicrometerMetricsExporter
 */
package hookrelay.micrometer;
