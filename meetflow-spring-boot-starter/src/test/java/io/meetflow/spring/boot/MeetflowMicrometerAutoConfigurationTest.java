package io.meetflow.spring.boot;

import io.meetflow.Meetflow;
import io.meetflow.micrometer.MicrometerMetricsExporter;
import io.meetflow.model.Platform;
import io.meetflow.spi.DraftGenerationTrigger;
import io.meetflow.spi.MetricsExporter;
import io.meetflow.spi.TranscriptSource;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MeetflowMicrometerAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(MeetflowMicrometerAutoConfiguration.class))
            .withUserConfiguration(MeterRegistryConfig.class);

    @Test
    void createsMicrometerExporterByDefault() {
        runner.run(ctx -> {
            assertTrue(ctx.containsBean("micrometerMetricsExporter"));
            assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
        });
    }

    @Test
    void respectsCustomNamePrefix() {
        runner.withPropertyValues("meetflow.metrics.name-prefix=sales.meetflow").run(ctx -> {
            var registry = ctx.getBean(MeterRegistry.class);
            assertNotNull(registry.find("sales.meetflow.events.ingested").counter());
            assertNotNull(registry.find("sales.meetflow.retry.queue.depth").gauge());
        });
    }

    @Test
    void disabledWhenPropertyFalse() {
        runner.withPropertyValues("meetflow.metrics.enabled=false").run(ctx ->
                assertFalse(ctx.containsBean("micrometerMetricsExporter")));
    }

    @Test
    void backsOffWhenCustomMetricsExporterPresent() {
        runner.withUserConfiguration(CustomExporterConfig.class).run(ctx -> {
            var exporter = ctx.getBean(MetricsExporter.class);
            assertFalse(exporter instanceof MicrometerMetricsExporter);
        });
    }

    @Test
    void pipelineReportsThroughRegistry() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(
                        DataSourceAutoConfiguration.class,
                        MeetflowMicrometerAutoConfiguration.class,
                        MeetflowAutoConfiguration.class))
                .withUserConfiguration(MeterRegistryConfig.class, PipelineConfig.class)
                .withPropertyValues(
                        "spring.datasource.url=jdbc:h2:mem:meetflow_metrics_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
                        "spring.datasource.driver-class-name=org.h2.Driver",
                        "meetflow.worker.enabled=false",
                        "meetflow.jdbc.initialize-schema=true")
                .run(ctx -> {
                    Meetflow meetflow = ctx.getBean(Meetflow.class);
                    meetflow.ingestor().ingest(Platform.GOOGLE_MEET, "google.workspace.meet.conference.v2.ended", "evt-1", "{}");
                    meetflow.ingestor().ingest(Platform.GOOGLE_MEET, "google.workspace.meet.conference.v2.ended", "evt-1", "{}");

                    var registry = ctx.getBean(MeterRegistry.class);
                    assertEquals(1.0, registry.find("meetflow.events.ingested").counter().count());
                    assertEquals(1.0, registry.find("meetflow.events.duplicate").counter().count());
                });
    }

    @Configuration
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration
    static class CustomExporterConfig {
        @Bean
        MetricsExporter customMetricsExporter() {
            return MetricsExporter.NOOP;
        }
    }

    @Configuration
    static class PipelineConfig {
        @Bean
        TranscriptSource transcriptSource() {
            return (meeting, transcript) -> "WEBVTT\n";
        }

        @Bean
        DraftGenerationTrigger draftTrigger() {
            return meetingId -> { };
        }
    }
}
