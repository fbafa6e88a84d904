package io.scilit.monitor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of the statistics gathered for one query fingerprint.
 *
 * @param fingerprint     normalized query text
 * @param executions      successful executions
 * @param failures        failed executions
 * @param totalDuration   sum of successful execution times
 * @param averageDuration {@code totalDuration / executions}, zero before the first success
 * @param maxDuration     slowest successful execution
 * @param p95Duration     95th percentile over the retained sample window
 * @param lastPlan        {@code EXPLAIN QUERY PLAN} detail lines of the latest execution; empty if not captured
 * @param fullScan        whether the latest plan scanned a whole table
 * @param lastExecutedAt  time of the latest execution, successful or not
 */
public record QueryStat(String fingerprint, long executions, long failures, Duration totalDuration,
    Duration averageDuration, Duration maxDuration, Duration p95Duration, List<String> lastPlan,
    boolean fullScan, Instant lastExecutedAt) {

  public QueryStat {
    Objects.requireNonNull(fingerprint, "fingerprint");
    lastPlan = List.copyOf(lastPlan);
  }
}
