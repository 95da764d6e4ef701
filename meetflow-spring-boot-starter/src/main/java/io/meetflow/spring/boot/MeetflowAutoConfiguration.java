package io.meetflow.spring.boot;

import io.meetflow.Meetflow;
import io.meetflow.dead.DeadLetterManager;
import io.meetflow.ingest.EventIngestor;
import io.meetflow.ingest.platform.PlatformEventAdapters;
import io.meetflow.jdbc.Dialect;
import io.meetflow.jdbc.JdbcSchema;
import io.meetflow.jdbc.JdbcStores;
import io.meetflow.jdbc.TableNames;
import io.meetflow.progress.ProcessingStateMachine;
import io.meetflow.retry.ExponentialBackoffRetryPolicy;
import io.meetflow.retry.LinearBackoffRetryPolicy;
import io.meetflow.retry.RetryPolicy;
import io.meetflow.retry.WebhookFailureQueue;
import io.meetflow.spi.ConnectionProvider;
import io.meetflow.spi.DeadLetterAlerter;
import io.meetflow.spi.DraftGenerationTrigger;
import io.meetflow.spi.MetricsExporter;
import io.meetflow.spi.TranscriptSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the meetflow pipeline.
 *
 * <p>Wires a {@link Meetflow} composite from a {@link DataSource} and
 * {@link MeetflowProperties}. The application supplies the {@link TranscriptSource} and
 * {@link DraftGenerationTrigger}; a {@link DeadLetterAlerter}, {@link MetricsExporter} or
 * {@link RetryPolicy} bean replaces the default.
 *
 * <p>The facades ({@link EventIngestor}, {@link ProcessingStateMachine},
 * {@link DeadLetterManager}, {@link WebhookFailureQueue}) are exposed as beans for
 * controllers to inject.
 *
 * @see MeetflowProperties
 * @see MeetflowMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(Meetflow.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(MeetflowProperties.class)
public class MeetflowAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(MeetflowAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public JdbcStores meetflowStores(DataSource dataSource, MeetflowProperties props) {
        Dialect dialect = Dialect.detect(dataSource);
        String prefix = props.getJdbc().getTablePrefix();
        TableNames tableNames = prefix == null || prefix.isEmpty()
            ? TableNames.DEFAULTS
            : TableNames.withPrefix(prefix);

        if (props.getJdbc().isInitializeSchema()) {
            if (!TableNames.DEFAULTS.equals(tableNames)) {
                throw new IllegalStateException(
                    "meetflow.jdbc.initialize-schema requires the default table names; "
                        + "create prefixed tables yourself");
            }
            JdbcSchema.install(dataSource, dialect);
            log.info("Installed meetflow schema for dialect {}", dialect.name());
        }
        return JdbcStores.builder()
            .dialect(dialect)
            .tableNames(tableNames)
            .build();
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public ConnectionProvider meetflowConnectionProvider(DataSource dataSource) {
        return dataSource::getConnection;
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy meetflowRetryPolicy(MeetflowProperties props) {
        MeetflowProperties.Retry retry = props.getRetry();
        return switch (retry.getPolicy()) {
            case LINEAR -> new LinearBackoffRetryPolicy(retry.getBaseDelayMs());
            case EXPONENTIAL -> new ExponentialBackoffRetryPolicy(retry.getBaseDelayMs(), retry.getMaxDelayMs());
        };
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public Meetflow meetflow(MeetflowProperties props,
            ConnectionProvider connectionProvider,
            JdbcStores stores,
            RetryPolicy retryPolicy,
            TranscriptSource transcriptSource,
            DraftGenerationTrigger draftTrigger,
            ObjectProvider<DeadLetterAlerter> alerterProvider,
            ObjectProvider<MetricsExporter> metricsProvider,
            ObjectProvider<PlatformEventAdapters> adaptersProvider) {

        MeetflowProperties.Worker worker = props.getWorker();
        Meetflow.Builder builder = Meetflow.builder()
            .connectionProvider(connectionProvider)
            .rawEventStore(stores.rawEvents())
            .meetingStore(stores.meetings())
            .transcriptStore(stores.transcripts())
            .failureStore(stores.webhookFailures())
            .deadLetterStore(stores.deadLetters())
            .transcriptSource(transcriptSource)
            .draftTrigger(draftTrigger)
            .retryPolicy(retryPolicy)
            .maxAttempts(props.getRetry().getMaxAttempts())
            .leaseMs(props.getRetry().getLeaseMs())
            .fetchTimeoutMs(props.getTranscript().getRequestTimeout().toMillis())
            .batchSize(worker.getBatchSize())
            .intervalMs(worker.getPollIntervalMs())
            .drainTimeoutMs(worker.getDrainTimeoutMs())
            .stuckTimeout(worker.getStuckTimeout())
            .generationTimeoutMs(worker.getGenerationTimeout().toMillis());

        DeadLetterAlerter alerter = alerterProvider.getIfAvailable();
        if (alerter != null) {
            builder.alerter(alerter);
        }
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        PlatformEventAdapters adapters = adaptersProvider.getIfAvailable();
        if (adapters != null) {
            builder.adapters(adapters);
        }

        Meetflow meetflow = builder.build();
        if (worker.isEnabled()) {
            meetflow.start();
            log.info("Meetflow worker started (poll interval {} ms, batch size {})",
                worker.getPollIntervalMs(), worker.getBatchSize());
        } else {
            log.info("Meetflow worker disabled; ingestion and operator APIs only");
        }
        return meetflow;
    }

    @Bean
    @ConditionalOnMissingBean
    public EventIngestor eventIngestor(Meetflow meetflow) {
        return meetflow.ingestor();
    }

    @Bean
    @ConditionalOnMissingBean
    public ProcessingStateMachine processingStateMachine(Meetflow meetflow) {
        return meetflow.stateMachine();
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterManager deadLetterManager(Meetflow meetflow) {
        return meetflow.deadLetters();
    }

    @Bean
    @ConditionalOnMissingBean
    public WebhookFailureQueue webhookFailureQueue(Meetflow meetflow) {
        return meetflow.failureQueue();
    }
}
