package io.scilit.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.scilit.micrometer.MicrometerMetricsExporter;
import io.scilit.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * and {@code scilit.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link ScilitAutoConfiguration} so the {@link MetricsExporter}
 * bean is available to the database manager and the query monitor.
 */
@AutoConfiguration(before = ScilitAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "scilit.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(ScilitProperties.class)
public class ScilitMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, ScilitProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
