/**
 * Service Provider Interfaces (SPI) for plugging relaydb into a host application.
 *
 * <p>These interfaces define the extension points that integrators implement
 * to supply connections, export metrics and observe backfill progress.
 *
 * @see io.relaydb.spi.ConnectionProvider
 * @see io.relaydb.spi.MetricsExporter
 * @see io.relaydb.spi.ProgressListener
 */
package io.relaydb.spi;
