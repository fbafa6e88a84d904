package io.scilit.spring.boot;

import io.scilit.DatabaseConfig;
import io.scilit.SynchronousMode;
import io.scilit.monitor.QueryPerformanceMonitor;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Paths;
import java.time.Duration;

/**
 * Configuration properties for the scientific literature store.
 *
 * @see ScilitAutoConfiguration
 */
@ConfigurationProperties(prefix = "scilit")
public class ScilitProperties {

    private final Database database = new Database();
    private final Monitor monitor = new Monitor();
    private final Metrics metrics = new Metrics();

    public Database getDatabase() {
        return database;
    }

    public Monitor getMonitor() {
        return monitor;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Database {
        /**
         * Path of the SQLite database file.
         */
        private String path = DatabaseConfig.DEFAULT_PATH.toString();
        private int poolSize = DatabaseConfig.DEFAULT_POOL_SIZE;
        private boolean walEnabled = true;
        /**
         * Page cache size per connection, in pages.
         */
        private int cacheSizePages = DatabaseConfig.DEFAULT_CACHE_SIZE_PAGES;
        private SynchronousMode synchronousMode = SynchronousMode.NORMAL;
        /**
         * How long to wait for an idle pooled connection.
         */
        private Duration acquireTimeout = DatabaseConfig.DEFAULT_ACQUIRE_TIMEOUT;
        /**
         * How long SQLite retries a locked database before failing.
         */
        private Duration busyTimeout = DatabaseConfig.DEFAULT_BUSY_TIMEOUT;
        /**
         * Schema script to run at startup. Defaults to schema.sql next to the
         * database file, else the bundled script.
         */
        private String schemaScript;

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public boolean isWalEnabled() {
            return walEnabled;
        }

        public void setWalEnabled(boolean walEnabled) {
            this.walEnabled = walEnabled;
        }

        public int getCacheSizePages() {
            return cacheSizePages;
        }

        public void setCacheSizePages(int cacheSizePages) {
            this.cacheSizePages = cacheSizePages;
        }

        public SynchronousMode getSynchronousMode() {
            return synchronousMode;
        }

        public void setSynchronousMode(SynchronousMode synchronousMode) {
            this.synchronousMode = synchronousMode;
        }

        public Duration getAcquireTimeout() {
            return acquireTimeout;
        }

        public void setAcquireTimeout(Duration acquireTimeout) {
            this.acquireTimeout = acquireTimeout;
        }

        public Duration getBusyTimeout() {
            return busyTimeout;
        }

        public void setBusyTimeout(Duration busyTimeout) {
            this.busyTimeout = busyTimeout;
        }

        public String getSchemaScript() {
            return schemaScript;
        }

        public void setSchemaScript(String schemaScript) {
            this.schemaScript = schemaScript;
        }

        /**
         * Converts these properties into a validated {@link DatabaseConfig}.
         *
         * @throws IllegalArgumentException if a value is out of range
         */
        public DatabaseConfig toConfig() {
            DatabaseConfig.Builder builder = DatabaseConfig.builder()
                    .path(path)
                    .poolSize(poolSize)
                    .walEnabled(walEnabled)
                    .cacheSizePages(cacheSizePages)
                    .synchronousMode(synchronousMode)
                    .acquireTimeout(acquireTimeout)
                    .busyTimeout(busyTimeout);
            if (schemaScript != null && !schemaScript.isBlank()) {
                builder.schemaScript(Paths.get(schemaScript));
            }
            return builder.build();
        }
    }

    public static class Monitor {
        /**
         * Run EXPLAIN QUERY PLAN before each monitored query.
         */
        private boolean explainQueryPlan = true;
        private Duration slowQueryThreshold = QueryPerformanceMonitor.DEFAULT_SLOW_QUERY_THRESHOLD;
        private int maxSamplesPerQuery = QueryPerformanceMonitor.DEFAULT_MAX_SAMPLES_PER_QUERY;

        public boolean isExplainQueryPlan() {
            return explainQueryPlan;
        }

        public void setExplainQueryPlan(boolean explainQueryPlan) {
            this.explainQueryPlan = explainQueryPlan;
        }

        public Duration getSlowQueryThreshold() {
            return slowQueryThreshold;
        }

        public void setSlowQueryThreshold(Duration slowQueryThreshold) {
            this.slowQueryThreshold = slowQueryThreshold;
        }

        public int getMaxSamplesPerQuery() {
            return maxSamplesPerQuery;
        }

        public void setMaxSamplesPerQuery(int maxSamplesPerQuery) {
            this.maxSamplesPerQuery = maxSamplesPerQuery;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "scilit";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
