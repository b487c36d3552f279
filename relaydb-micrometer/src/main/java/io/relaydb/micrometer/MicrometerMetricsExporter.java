package io.relaydb.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.relaydb.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code relaydb.migration.applied}: migrations applied and committed</li>
 *   <li>{@code relaydb.migration.skipped}: migrations already recorded in the ledger</li>
 *   <li>{@code relaydb.migration.failed}: failed migrations and backfills</li>
 *   <li>{@code relaydb.backfill.events}: events read by backfills</li>
 *   <li>{@code relaydb.backfill.tags}: tag rows written by backfills</li>
 * </ul>
 *
 * <h3>Summaries</h3>
 * <ul>
 *   <li>{@code relaydb.migration.duration.ms}: time spent applying one migration</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code relaydb.schema.version}: schema version after the last upgrade</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  public static final String DEFAULT_PREFIX = "relaydb";

  private final MeterRegistry registry;
  private final Counter applied;
  private final Counter skipped;
  private final Counter failed;
  private final Counter backfillEvents;
  private final Counter backfillTags;
  private final DistributionSummary duration;
  private final Gauge schemaVersionGauge;

  private final AtomicLong schemaVersion = new AtomicLong();
  private volatile boolean closed;

  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, DEFAULT_PREFIX);
  }

  /**
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "relay.db"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.applied = Counter.builder(namePrefix + ".migration.applied")
        .description("Migrations applied and committed")
        .register(registry);
    this.skipped = Counter.builder(namePrefix + ".migration.skipped")
        .description("Migrations already recorded in the ledger")
        .register(registry);
    this.failed = Counter.builder(namePrefix + ".migration.failed")
        .description("Migrations or backfills that failed")
        .register(registry);
    this.backfillEvents = Counter.builder(namePrefix + ".backfill.events")
        .description("Events read by backfills")
        .register(registry);
    this.backfillTags = Counter.builder(namePrefix + ".backfill.tags")
        .description("Tag rows written by backfills")
        .register(registry);
    this.duration = DistributionSummary.builder(namePrefix + ".migration.duration.ms")
        .description("Time spent applying one migration")
        .baseUnit("milliseconds")
        .register(registry);
    this.schemaVersionGauge = Gauge.builder(namePrefix + ".schema.version", schemaVersion, AtomicLong::get)
        .description("Schema version recorded in the ledger")
        .register(registry);
  }

  @Override
  public void incrementMigrationApplied() {
    if (closed) return;
    applied.increment();
  }

  @Override
  public void incrementMigrationSkipped() {
    if (closed) return;
    skipped.increment();
  }

  @Override
  public void incrementMigrationFailed() {
    if (closed) return;
    failed.increment();
  }

  @Override
  public void recordMigrationDurationMs(long durationMs) {
    if (closed) return;
    duration.record(durationMs);
  }

  @Override
  public void recordSchemaVersion(long version) {
    if (closed) return;
    schemaVersion.set(version);
  }

  @Override
  public void incrementBackfillEvents(long count) {
    if (closed) return;
    backfillEvents.increment(count);
  }

  @Override
  public void incrementBackfillTags(long count) {
    if (closed) return;
    backfillTags.increment(count);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(applied, skipped, failed, backfillEvents, backfillTags,
        duration, schemaVersionGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
