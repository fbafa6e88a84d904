package io.scilit.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.scilit.ErrorKind;
import io.scilit.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers meters with a {@link MeterRegistry} for export to Prometheus,
 * Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code scilit.query.duration}: monitored query execution time</li>
 * </ul>
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code scilit.query.failure}: failed monitored queries, tagged {@code kind}</li>
 *   <li>{@code scilit.query.slow}: queries over the slow-query threshold</li>
 *   <li>{@code scilit.pool.exhausted}: acquisitions that timed out</li>
 *   <li>{@code scilit.tx.committed}: committed transactions</li>
 *   <li>{@code scilit.tx.rolledback}: rolled back transactions</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code scilit.pool.in.use}: connections currently checked out</li>
 *   <li>{@code scilit.pool.idle}: connections idle in the pool</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Timer queryDuration;
  private final Map<ErrorKind, Counter> queryFailures = new EnumMap<>(ErrorKind.class);
  private final Counter slowQueries;
  private final Counter poolExhausted;
  private final Counter txCommitted;
  private final Counter txRolledBack;
  private final Gauge inUseGauge;
  private final Gauge idleGauge;

  private final AtomicInteger inUse = new AtomicInteger();
  private final AtomicInteger idle = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "scilit"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "scilit");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for several databases in one registry.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "catalog.db"})
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
    this.queryDuration = Timer.builder(namePrefix + ".query.duration")
        .description("Monitored query execution time")
        .register(registry);
    for (ErrorKind kind : ErrorKind.values()) {
      queryFailures.put(kind, Counter.builder(namePrefix + ".query.failure")
          .description("Monitored queries that failed")
          .tag("kind", kind.name().toLowerCase(Locale.ROOT))
          .register(registry));
    }
    this.slowQueries = Counter.builder(namePrefix + ".query.slow")
        .description("Monitored queries slower than the threshold")
        .register(registry);
    this.poolExhausted = Counter.builder(namePrefix + ".pool.exhausted")
        .description("Connection acquisitions that timed out")
        .register(registry);
    this.txCommitted = Counter.builder(namePrefix + ".tx.committed")
        .description("Committed transactions")
        .register(registry);
    this.txRolledBack = Counter.builder(namePrefix + ".tx.rolledback")
        .description("Rolled back transactions")
        .register(registry);

    this.inUseGauge = Gauge.builder(namePrefix + ".pool.in.use", inUse, AtomicInteger::get)
        .register(registry);
    this.idleGauge = Gauge.builder(namePrefix + ".pool.idle", idle, AtomicInteger::get)
        .register(registry);
  }

  @Override
  public void recordQueryDuration(long durationNanos) {
    if (closed) return;
    queryDuration.record(durationNanos, TimeUnit.NANOSECONDS);
  }

  @Override
  public void incrementQueryFailure(ErrorKind kind) {
    if (closed) return;
    queryFailures.get(Objects.requireNonNull(kind, "kind")).increment();
  }

  @Override
  public void incrementSlowQuery() {
    if (closed) return;
    slowQueries.increment();
  }

  @Override
  public void incrementPoolExhausted() {
    if (closed) return;
    poolExhausted.increment();
  }

  @Override
  public void recordPoolUsage(int inUse, int idle) {
    if (closed) return;
    this.inUse.set(inUse);
    this.idle.set(idle);
  }

  @Override
  public void incrementTransactionCommitted() {
    if (closed) return;
    txCommitted.increment();
  }

  @Override
  public void incrementTransactionRolledBack() {
    if (closed) return;
    txRolledBack.increment();
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the {@link io.scilit.DatabaseManager} using it is closed,
   * to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(queryDuration, slowQueries, poolExhausted,
        txCommitted, txRolledBack, inUseGauge, idleGauge));
    meters.addAll(queryFailures.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
