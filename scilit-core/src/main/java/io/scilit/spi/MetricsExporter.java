package io.scilit.spi;

import io.scilit.ErrorKind;

/**
 * Observability hook for exporting store counters, timers and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Records the wall-clock duration of one monitored query execution.
     *
     * @param durationNanos execution time in nanoseconds (always non-negative)
     */
    void recordQueryDuration(long durationNanos);

    /**
     * Increments the count of monitored queries that failed.
     *
     * @param kind classified cause of the failure
     */
    void incrementQueryFailure(ErrorKind kind);

    /**
     * Increments the count of monitored queries slower than the configured threshold.
     */
    default void incrementSlowQuery() {
    }

    /**
     * Increments the count of acquisitions that timed out because every connection was checked out.
     */
    void incrementPoolExhausted();

    /**
     * Records the current split of live connections.
     *
     * @param inUse connections currently checked out
     * @param idle  connections waiting in the pool
     */
    void recordPoolUsage(int inUse, int idle);

    /**
     * Increments the count of committed transactions.
     */
    default void incrementTransactionCommitted() {
    }

    /**
     * Increments the count of rolled back transactions.
     */
    default void incrementTransactionRolledBack() {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void recordQueryDuration(long durationNanos) {
        }

        @Override
        public void incrementQueryFailure(ErrorKind kind) {
        }

        @Override
        public void incrementPoolExhausted() {
        }

        @Override
        public void recordPoolUsage(int inUse, int idle) {
        }
    }
}
