/**
 * Micrometer bridge for exporting store metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link io.scilit.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.scilit.spi.MetricsExporter} SPI using Micrometer timers, counters and gauges.
 *
 * @see io.scilit.micrometer.MicrometerMetricsExporter
 */
package io.scilit.micrometer;
