/**
 * Micrometer bridge for exporting schema upgrade and backfill metrics.
 *
 * <p>{@link io.relaydb.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.relaydb.spi.MetricsExporter} SPI using Micrometer counters, a summary and a gauge.
 *
 * @see io.relaydb.micrometer.MicrometerMetricsExporter
 */
package io.relaydb.micrometer;
