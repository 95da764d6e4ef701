package io.meetflow.demo.worker;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.meetflow.Meetflow;
import io.meetflow.ingest.IngestResult;
import io.meetflow.jdbc.JdbcSchema;
import io.meetflow.jdbc.JdbcStores;
import io.meetflow.model.Platform;
import io.meetflow.spi.TranscriptSource;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Standalone worker process: polls the pipeline tables on the main thread until the JVM is
 * asked to stop, then drains in-flight work from a shutdown hook.
 *
 * <p>Transcripts come from a fixture source so the process runs without platform credentials.
 *
 * <p>Run with: mvn -pl samples/meetflow-worker exec:java \
 * -Dexec.mainClass=io.meetflow.demo.worker.MeetflowWorker -Dexec.args="--demo"
 */
public final class MeetflowWorker {
    private static final Logger logger = Logger.getLogger(MeetflowWorker.class.getName());

    static final String SAMPLE_VTT = String.join("\n",
        "WEBVTT",
        "",
        "00:00:01.000 --> 00:00:04.000",
        "<v Alice>Thanks for joining, let's review the rollout.</v>",
        "",
        "00:00:05.000 --> 00:00:09.000",
        "Bob: The migration finished yesterday.",
        "");

    private MeetflowWorker() {
    }

    public static void main(String[] args) {
        WorkerOptions options = WorkerOptions.parse(args);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(options.jdbcUrl());
        config.setUsername(options.username());
        config.setPassword(options.password());
        config.setMaximumPoolSize(4);
        config.setPoolName("meetflow-worker");
        HikariDataSource dataSource = new HikariDataSource(config);

        JdbcStores stores = JdbcStores.detect(dataSource);
        if (options.initSchema()) {
            JdbcSchema.install(dataSource, stores.dialect());
            logger.log(Level.INFO, "Installed {0} schema", stores.dialect().name());
        }

        Meetflow meetflow = Meetflow.builder()
            .connectionProvider(dataSource::getConnection)
            .rawEventStore(stores.rawEvents())
            .meetingStore(stores.meetings())
            .transcriptStore(stores.transcripts())
            .failureStore(stores.webhookFailures())
            .deadLetterStore(stores.deadLetters())
            .transcriptSource(fixtureSource())
            .draftTrigger(meetingId -> logger.log(Level.INFO, "Draft generation requested for meeting {0}", meetingId))
            .intervalMs(2000)
            .build();

        Thread main = Thread.currentThread();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            meetflow.worker().shutdown("SIGTERM");
            try {
                main.join(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            try {
                meetflow.close();
            } finally {
                dataSource.close();
            }
        }, "meetflow-shutdown"));

        if (options.demo()) {
            List<IngestResult> results = meetflow.ingestor().ingestDelivery(Platform.ZOOM, sampleZoomWebhook());
            logger.log(Level.INFO, "Ingested sample webhook as raw event {0}", results.get(0).rawEventId());
        }

        meetflow.worker().run();
    }

    private static TranscriptSource fixtureSource() {
        return (meeting, transcript) -> {
            logger.log(Level.INFO, "Serving fixture transcript for {0} meeting {1}",
                new Object[]{meeting.platform().code(), meeting.platformMeetingId()});
            return SAMPLE_VTT;
        };
    }

    static String sampleZoomWebhook() {
        long now = System.currentTimeMillis();
        return "{"
            + "\"event\":\"recording.transcript_completed\","
            + "\"event_ts\":" + now + ","
            + "\"payload\":{\"object\":{"
            + "\"uuid\":\"demo-" + now + "\","
            + "\"id\":85012345678,"
            + "\"host_email\":\"host@example.com\","
            + "\"topic\":\"Rollout review\","
            + "\"recording_files\":["
            + "{\"file_type\":\"TRANSCRIPT\",\"download_url\":\"https://zoom.example/rec/demo\"}"
            + "]}}}";
    }
}
