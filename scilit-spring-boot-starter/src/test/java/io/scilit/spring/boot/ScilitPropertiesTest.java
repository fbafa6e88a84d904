package io.scilit.spring.boot;

import io.scilit.DatabaseConfig;
import io.scilit.SynchronousMode;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScilitPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(ScilitProperties.class);
            assertEquals(Paths.get("data", "scientific_literature.db").toString(), props.getDatabase().getPath());
            assertEquals(5, props.getDatabase().getPoolSize());
            assertTrue(props.getDatabase().isWalEnabled());
            assertEquals(2000, props.getDatabase().getCacheSizePages());
            assertEquals(SynchronousMode.NORMAL, props.getDatabase().getSynchronousMode());
            assertEquals(Duration.ofSeconds(30), props.getDatabase().getAcquireTimeout());
            assertEquals(Duration.ofSeconds(5), props.getDatabase().getBusyTimeout());
            assertNull(props.getDatabase().getSchemaScript());
            assertTrue(props.getMonitor().isExplainQueryPlan());
            assertEquals(Duration.ofMillis(100), props.getMonitor().getSlowQueryThreshold());
            assertEquals(1024, props.getMonitor().getMaxSamplesPerQuery());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("scilit", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "scilit.database.path=/var/lib/scilit/papers.db",
                "scilit.database.schema-script=/etc/scilit/schema.sql",
                "scilit.monitor.explain-query-plan=false",
                "scilit.monitor.slow-query-threshold=250ms",
                "scilit.monitor.max-samples-per-query=64",
                "scilit.metrics.enabled=false",
                "scilit.metrics.name-prefix=papers").run(ctx -> {
                    var props = ctx.getBean(ScilitProperties.class);
                    assertEquals("/var/lib/scilit/papers.db", props.getDatabase().getPath());
                    assertEquals("/etc/scilit/schema.sql", props.getDatabase().getSchemaScript());
                    assertFalse(props.getMonitor().isExplainQueryPlan());
                    assertEquals(Duration.ofMillis(250), props.getMonitor().getSlowQueryThreshold());
                    assertEquals(64, props.getMonitor().getMaxSamplesPerQuery());
                    assertFalse(props.getMetrics().isEnabled());
                    assertEquals("papers", props.getMetrics().getNamePrefix());
                });
    }

    @Test
    void toConfigCarriesSchemaScript() {
        var database = new ScilitProperties.Database();
        database.setSchemaScript("conf/schema.sql");
        DatabaseConfig config = database.toConfig();
        assertEquals(Optional.of(Paths.get("conf/schema.sql")), config.schemaScript());
        assertEquals(DatabaseConfig.DEFAULT_PATH, config.path());
    }

    @Test
    void toConfigIgnoresBlankSchemaScript() {
        var database = new ScilitProperties.Database();
        database.setSchemaScript("  ");
        assertEquals(Optional.empty(), database.toConfig().schemaScript());
    }

    @Configuration
    @EnableConfigurationProperties(ScilitProperties.class)
    static class PropsConfig {
    }
}
