package io.scilit.monitor;

import java.time.Duration;
import java.util.List;

/**
 * Summary of everything a {@link QueryPerformanceMonitor} has recorded since it was
 * created or last reset. Percentiles are computed over the retained sample windows
 * of all fingerprints.
 *
 * @param slowestQueries    up to {@link QueryPerformanceMonitor#SLOWEST_QUERIES_LIMIT} fingerprints,
 *                          slowest average first
 * @param fullScanQueries   fingerprints whose latest plan scanned a whole table
 */
public record PerformanceReport(long totalExecutions, long totalFailures, int distinctQueries,
    Duration averageDuration, Duration p50Duration, Duration p95Duration, Duration p99Duration,
    List<QueryStat> queries, List<QueryStat> slowestQueries, List<String> fullScanQueries) {

  public PerformanceReport {
    queries = List.copyOf(queries);
    slowestQueries = List.copyOf(slowestQueries);
    fullScanQueries = List.copyOf(fullScanQueries);
  }
}
