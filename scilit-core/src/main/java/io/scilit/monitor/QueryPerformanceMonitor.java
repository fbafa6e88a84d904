package io.scilit.monitor;

import io.scilit.DatabaseManager;
import io.scilit.ErrorKind;
import io.scilit.QueryExecutionException;
import io.scilit.jdbc.JdbcTemplate;
import io.scilit.jdbc.JdbcTemplate.RowMapper;
import io.scilit.jdbc.Row;
import io.scilit.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Executes queries through a {@link DatabaseManager} while recording timing and
 * query-plan statistics per {@linkplain QueryFingerprint fingerprint}.
 *
 * <p>Parameters are always bound, never concatenated into the SQL text, so two
 * calls differing only in their values share one fingerprint and one {@link QueryStat}.
 *
 * <p>Create instances via {@link #builder(DatabaseManager)}. This class is thread-safe.
 */
public final class QueryPerformanceMonitor {
  private static final Logger logger = Logger.getLogger(QueryPerformanceMonitor.class.getName());

  /** Number of fingerprints listed in {@link PerformanceReport#slowestQueries()}. */
  public static final int SLOWEST_QUERIES_LIMIT = 10;

  public static final Duration DEFAULT_SLOW_QUERY_THRESHOLD = Duration.ofMillis(100);
  public static final int DEFAULT_MAX_SAMPLES_PER_QUERY = 1024;

  private final DatabaseManager manager;
  private final boolean explainQueryPlan;
  private final Duration slowQueryThreshold;
  private final int maxSamplesPerQuery;
  private final MetricsExporter metrics;
  private final Map<String, QueryStatAccumulator> stats = new ConcurrentHashMap<>();

  private QueryPerformanceMonitor(Builder builder) {
    this.manager = Objects.requireNonNull(builder.manager, "manager");
    this.slowQueryThreshold = Objects.requireNonNull(builder.slowQueryThreshold, "slowQueryThreshold");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.explainQueryPlan = builder.explainQueryPlan;
    this.maxSamplesPerQuery = builder.maxSamplesPerQuery;

    if (slowQueryThreshold.isNegative()) {
      throw new IllegalArgumentException("slowQueryThreshold must be >= 0");
    }
    if (maxSamplesPerQuery < 1) {
      throw new IllegalArgumentException("maxSamplesPerQuery must be >= 1");
    }
  }

  public static Builder builder(DatabaseManager manager) {
    return new Builder(manager);
  }

  /**
   * Executes {@code sql} with {@code params} bound in order and returns the result rows.
   * Statements without a result set return an empty list.
   *
   * @throws QueryExecutionException if the statement fails; the cause is the store error
   */
  public List<Row> executeWithMonitoring(String sql, Object... params) {
    return executeWithMonitoring(sql, Row::of, params);
  }

  /**
   * Executes {@code sql} with {@code params} bound in order and maps each result row.
   *
   * @throws QueryExecutionException if the statement fails; the cause is the store error
   */
  public <T> List<T> executeWithMonitoring(String sql, RowMapper<T> mapper, Object... params) {
    Objects.requireNonNull(sql, "sql");
    Objects.requireNonNull(mapper, "mapper");
    Object[] bindings = params == null ? new Object[0] : params;
    String fingerprint = QueryFingerprint.normalize(sql);

    return manager.withConnection("monitored-query", conn -> {
      // registered after acquisition; pool exhaustion leaves no entry
      QueryStatAccumulator stat = stats.computeIfAbsent(fingerprint,
          f -> new QueryStatAccumulator(f, maxSamplesPerQuery));
      List<String> plan = null;
      long start = System.nanoTime();
      List<T> rows;
      try {
        if (explainQueryPlan) {
          plan = explain(conn, sql, bindings);
          start = System.nanoTime();
        }
        rows = JdbcTemplate.execute(conn, sql, mapper, bindings);
      } catch (SQLException | RuntimeException e) {
        throw failed(stat, fingerprint, bindings, e);
      }
      long elapsed = System.nanoTime() - start;
      stat.recordSuccess(elapsed, plan, Instant.now());
      metrics.recordQueryDuration(elapsed);
      if (elapsed > slowQueryThreshold.toNanos()) {
        metrics.incrementSlowQuery();
        logger.warning("Slow query (" + Duration.ofNanos(elapsed).toMillis() + " ms): " + fingerprint
            + (plan == null ? "" : " plan=" + plan));
      } else if (logger.isLoggable(Level.FINE)) {
        logger.fine("Query " + fingerprint + " took " + elapsed / 1000 + " us"
            + (plan == null ? "" : " plan=" + plan));
      }
      return rows;
    });
  }

  /** Snapshot of the statistics for the fingerprint of {@code sql}, if it ever ran. */
  public Optional<QueryStat> getQueryStat(String sql) {
    QueryStatAccumulator stat = stats.get(QueryFingerprint.normalize(sql));
    return stat == null ? Optional.empty() : Optional.of(stat.snapshot());
  }

  /** Summarizes recorded statistics. Does not touch the database. */
  public PerformanceReport getPerformanceReport() {
    List<QueryStat> queries = new ArrayList<>();
    List<long[]> windows = new ArrayList<>();
    for (QueryStatAccumulator accumulator : stats.values()) {
      queries.add(accumulator.snapshot());
      windows.add(accumulator.samples());
    }
    queries.sort(Comparator.comparing(QueryStat::fingerprint));

    long executions = 0;
    long failures = 0;
    long totalNanos = 0;
    for (QueryStat q : queries) {
      executions += q.executions();
      failures += q.failures();
      totalNanos += q.totalDuration().toNanos();
    }
    long[] all = windows.stream().flatMapToLong(Arrays::stream).sorted().toArray();
    Duration average = executions == 0 ? Duration.ZERO : Duration.ofNanos(totalNanos / executions);

    List<QueryStat> slowest = queries.stream()
        .filter(q -> q.executions() > 0)
        .sorted(Comparator.comparing(QueryStat::averageDuration).reversed())
        .limit(SLOWEST_QUERIES_LIMIT)
        .collect(Collectors.toList());
    List<String> fullScans = queries.stream()
        .filter(QueryStat::fullScan)
        .map(QueryStat::fingerprint)
        .collect(Collectors.toList());

    return new PerformanceReport(executions, failures, queries.size(), average,
        Duration.ofNanos(QueryStatAccumulator.percentile(all, 0.50)),
        Duration.ofNanos(QueryStatAccumulator.percentile(all, 0.95)),
        Duration.ofNanos(QueryStatAccumulator.percentile(all, 0.99)),
        queries, slowest, fullScans);
  }

  /** Discards all recorded statistics. */
  public void reset() {
    stats.clear();
    logger.info("Query statistics reset");
  }

  private QueryExecutionException failed(QueryStatAccumulator stat, String fingerprint, Object[] params,
      Exception error) {
    ErrorKind kind = ErrorKind.of(error);
    stat.recordFailure(Instant.now());
    metrics.incrementQueryFailure(kind);
    // the stack trace is logged once, by the enclosing connection scope
    logger.warning("Query failed [" + kind + "]: " + fingerprint
        + " params=" + parameterShapes(params) + " error=" + error.getMessage());
    return new QueryExecutionException(fingerprint, kind, error);
  }

  private static List<String> explain(Connection conn, String sql, Object[] params) throws SQLException {
    return JdbcTemplate.execute(conn, "EXPLAIN QUERY PLAN " + sql, rs -> rs.getString("detail"), params);
  }

  // type names only; values may be sensitive
  static List<String> parameterShapes(Object[] params) {
    List<String> shapes = new ArrayList<>(params.length);
    for (Object param : params) {
      shapes.add(param == null ? "null" : param.getClass().getSimpleName());
    }
    return shapes;
  }

  /** Builder for {@link QueryPerformanceMonitor}. */
  public static final class Builder {
    private final DatabaseManager manager;
    private boolean explainQueryPlan = true;
    private Duration slowQueryThreshold = DEFAULT_SLOW_QUERY_THRESHOLD;
    private int maxSamplesPerQuery = DEFAULT_MAX_SAMPLES_PER_QUERY;
    private MetricsExporter metrics;

    private Builder(DatabaseManager manager) {
      this.manager = manager;
    }

    /**
     * Whether to run {@code EXPLAIN QUERY PLAN} before each execution.
     *
     * <p>Optional. Defaults to {@code true}.
     *
     * @param explainQueryPlan true to capture plans
     * @return this builder
     */
    public Builder explainQueryPlan(boolean explainQueryPlan) {
      this.explainQueryPlan = explainQueryPlan;
      return this;
    }

    /**
     * Executions slower than this are logged at WARNING and counted as slow.
     *
     * <p>Optional. Defaults to 100 ms.
     *
     * @param slowQueryThreshold non-negative threshold
     * @return this builder
     */
    public Builder slowQueryThreshold(Duration slowQueryThreshold) {
      this.slowQueryThreshold = slowQueryThreshold;
      return this;
    }

    /**
     * Size of the per-fingerprint sample window used for percentiles.
     *
     * <p>Optional. Defaults to 1024.
     *
     * @param maxSamplesPerQuery window size, at least 1
     * @return this builder
     */
    public Builder maxSamplesPerQuery(int maxSamplesPerQuery) {
      this.maxSamplesPerQuery = maxSamplesPerQuery;
      return this;
    }

    /**
     * Sets the metrics exporter for query timings and failures.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Builds the monitor.
     *
     * @return a new {@link QueryPerformanceMonitor}
     * @throws NullPointerException if the manager is null
     * @throws IllegalArgumentException if an option is out of range
     */
    public QueryPerformanceMonitor build() {
      return new QueryPerformanceMonitor(this);
    }
  }
}
