package io.scilit.spring.boot;

import io.scilit.DatabaseConfig;
import io.scilit.DatabaseManager;
import io.scilit.monitor.QueryPerformanceMonitor;
import io.scilit.schema.SchemaValidator;
import io.scilit.spi.MetricsExporter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the scientific literature store.
 *
 * <p>Builds a {@link DatabaseConfig} from {@code scilit.database.*}, then a
 * {@link DatabaseManager} that is initialized when the context starts and closed
 * with it, plus a {@link SchemaValidator} and a {@link QueryPerformanceMonitor}
 * over that manager. A {@link MetricsExporter} bean, if present, is passed to both.
 *
 * @see ScilitProperties
 * @see ScilitMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(DatabaseManager.class)
@EnableConfigurationProperties(ScilitProperties.class)
public class ScilitAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public DatabaseConfig scilitDatabaseConfig(ScilitProperties props) {
        return props.getDatabase().toConfig();
    }

    @Bean(initMethod = "initialize", destroyMethod = "close")
    @ConditionalOnMissingBean
    public DatabaseManager databaseManager(DatabaseConfig config,
                                           ObjectProvider<MetricsExporter> metricsProvider) {
        return new DatabaseManager(config, metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP));
    }

    @Bean
    @ConditionalOnMissingBean
    public SchemaValidator schemaValidator(DatabaseManager databaseManager) {
        return new SchemaValidator(databaseManager);
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryPerformanceMonitor queryPerformanceMonitor(DatabaseManager databaseManager,
                                                           ScilitProperties props,
                                                           ObjectProvider<MetricsExporter> metricsProvider) {
        ScilitProperties.Monitor monitor = props.getMonitor();
        return QueryPerformanceMonitor.builder(databaseManager)
                .explainQueryPlan(monitor.isExplainQueryPlan())
                .slowQueryThreshold(monitor.getSlowQueryThreshold())
                .maxSamplesPerQuery(monitor.getMaxSamplesPerQuery())
                .metrics(metricsProvider.getIfAvailable())
                .build();
    }
}
