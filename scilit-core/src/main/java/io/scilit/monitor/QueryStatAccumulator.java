package io.scilit.monitor;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Mutable per-fingerprint statistics. Keeps the most recent {@code capacity}
 * durations in a ring buffer for percentiles; counts and totals cover every execution.
 */
final class QueryStatAccumulator {
  private final String fingerprint;
  private final long[] window;
  private int next;
  private int filled;

  private long executions;
  private long failures;
  private long totalNanos;
  private long maxNanos;
  private List<String> lastPlan = List.of();
  private boolean fullScan;
  private Instant lastExecutedAt;

  QueryStatAccumulator(String fingerprint, int capacity) {
    this.fingerprint = fingerprint;
    this.window = new long[capacity];
  }

  synchronized void recordSuccess(long durationNanos, List<String> plan, Instant at) {
    executions++;
    totalNanos += durationNanos;
    maxNanos = Math.max(maxNanos, durationNanos);
    window[next] = durationNanos;
    next = (next + 1) % window.length;
    filled = Math.min(filled + 1, window.length);
    if (plan != null) {
      lastPlan = plan;
      fullScan = isFullScan(plan);
    }
    lastExecutedAt = at;
  }

  synchronized void recordFailure(Instant at) {
    failures++;
    lastExecutedAt = at;
  }

  synchronized long[] samples() {
    return Arrays.copyOf(window, filled);
  }

  synchronized QueryStat snapshot() {
    long[] sorted = Arrays.copyOf(window, filled);
    Arrays.sort(sorted);
    Duration average = executions == 0 ? Duration.ZERO : Duration.ofNanos(totalNanos / executions);
    return new QueryStat(fingerprint, executions, failures, Duration.ofNanos(totalNanos), average,
        Duration.ofNanos(maxNanos), Duration.ofNanos(percentile(sorted, 0.95)), lastPlan, fullScan,
        lastExecutedAt);
  }

  /** Nearest-rank percentile of an ascending array; 0 when empty. */
  static long percentile(long[] sorted, double p) {
    if (sorted.length == 0) {
      return 0;
    }
    int rank = (int) Math.ceil(p * sorted.length);
    return sorted[Math.max(0, Math.min(sorted.length, rank) - 1)];
  }

  // SQLite reports "SCAN <table>" (older releases "SCAN TABLE <table>") for a full pass
  static boolean isFullScan(List<String> plan) {
    for (String detail : plan) {
      if (detail.startsWith("SCAN ")) {
        return true;
      }
    }
    return false;
  }
}
