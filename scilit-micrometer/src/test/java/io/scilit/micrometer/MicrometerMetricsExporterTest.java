package io.scilit.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.scilit.ErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void recordQueryDuration() {
    exporter.recordQueryDuration(TimeUnit.MILLISECONDS.toNanos(5));
    exporter.recordQueryDuration(TimeUnit.MILLISECONDS.toNanos(15));

    Timer timer = registry.find("scilit.query.duration").timer();
    assertNotNull(timer);
    assertEquals(2, timer.count());
    assertEquals(20.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
  }

  @Test
  void queryFailuresAreTaggedByKind() {
    exporter.incrementQueryFailure(ErrorKind.CONSTRAINT);
    exporter.incrementQueryFailure(ErrorKind.CONSTRAINT);
    exporter.incrementQueryFailure(ErrorKind.SYNTAX);

    assertEquals(2.0, failures("constraint").count());
    assertEquals(1.0, failures("syntax").count());
    assertEquals(0.0, failures("busy").count());
  }

  @Test
  void incrementSlowQuery() {
    exporter.incrementSlowQuery();
    assertEquals(1.0, counter("scilit.query.slow").count());
  }

  @Test
  void incrementPoolExhausted() {
    exporter.incrementPoolExhausted();
    exporter.incrementPoolExhausted();
    assertEquals(2.0, counter("scilit.pool.exhausted").count());
  }

  @Test
  void transactionCounters() {
    exporter.incrementTransactionCommitted();
    exporter.incrementTransactionCommitted();
    exporter.incrementTransactionRolledBack();
    assertEquals(2.0, counter("scilit.tx.committed").count());
    assertEquals(1.0, counter("scilit.tx.rolledback").count());
  }

  @Test
  void recordPoolUsage() {
    exporter.recordPoolUsage(3, 2);
    assertEquals(3.0, gauge("scilit.pool.in.use").value());
    assertEquals(2.0, gauge("scilit.pool.idle").value());

    exporter.recordPoolUsage(0, 5);
    assertEquals(0.0, gauge("scilit.pool.in.use").value());
    assertEquals(5.0, gauge("scilit.pool.idle").value());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "catalog.db");
    custom.incrementPoolExhausted();
    custom.recordPoolUsage(1, 4);

    assertEquals(1.0, counter("catalog.db.pool.exhausted").count());
    assertEquals(4.0, gauge("catalog.db.pool.idle").value());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.close();
    exporter.incrementPoolExhausted();
    exporter.recordQueryDuration(1_000L);

    assertNull(registry.find("scilit.pool.exhausted").counter());
    assertNull(registry.find("scilit.query.duration").timer());
    assertNull(registry.find("scilit.query.failure").counter());
    assertNull(registry.find("scilit.pool.in.use").gauge());
  }

  @Test
  void nullRegistryThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void invalidPrefixThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "scilit."));
  }

  private Counter failures(String kind) {
    Counter c = registry.find("scilit.query.failure").tag("kind", kind).counter();
    assertNotNull(c, "Failure counter not found for kind " + kind);
    return c;
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }
}
