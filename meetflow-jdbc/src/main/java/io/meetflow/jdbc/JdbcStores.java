package io.meetflow.jdbc;

import io.meetflow.jdbc.store.JdbcDeadLetterStore;
import io.meetflow.jdbc.store.JdbcMeetingStore;
import io.meetflow.jdbc.store.JdbcRawEventStore;
import io.meetflow.jdbc.store.JdbcTranscriptStore;
import io.meetflow.jdbc.store.JdbcWebhookFailureStore;
import io.meetflow.spi.DeadLetterStore;
import io.meetflow.spi.MeetingStore;
import io.meetflow.spi.RawEventStore;
import io.meetflow.spi.TranscriptStore;
import io.meetflow.spi.WebhookFailureStore;
import io.meetflow.util.JsonCodec;

import javax.sql.DataSource;
import java.util.Objects;

/**
 * The five pipeline stores built over one {@link Dialect} and one set of {@link TableNames}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect the dialect from a DataSource, default table names
 * JdbcStores stores = JdbcStores.detect(dataSource);
 *
 * // Explicit dialect and prefixed tables
 * JdbcStores stores = JdbcStores.builder()
 *     .dialect(Dialect.POSTGRESQL)
 *     .tableNames(TableNames.withPrefix("mf_"))
 *     .build();
 * }</pre>
 */
public final class JdbcStores {
    private final Dialect dialect;
    private final TableNames tableNames;
    private final RawEventStore rawEvents;
    private final MeetingStore meetings;
    private final TranscriptStore transcripts;
    private final WebhookFailureStore webhookFailures;
    private final DeadLetterStore deadLetters;

    private JdbcStores(Builder builder) {
        this.dialect = Objects.requireNonNull(builder.dialect, "dialect");
        this.tableNames = builder.tableNames != null ? builder.tableNames : TableNames.DEFAULTS;
        JsonCodec jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
        this.rawEvents = new JdbcRawEventStore(dialect, tableNames, jsonCodec);
        this.meetings = new JdbcMeetingStore(dialect, tableNames, jsonCodec);
        this.transcripts = new JdbcTranscriptStore(dialect, tableNames, jsonCodec);
        this.webhookFailures = new JdbcWebhookFailureStore(dialect, tableNames, jsonCodec);
        this.deadLetters = new JdbcDeadLetterStore(dialect, tableNames, jsonCodec);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates stores with default table names for the dialect detected from {@code dataSource}.
     *
     * @throws IllegalStateException if the database is not supported
     */
    public static JdbcStores detect(DataSource dataSource) {
        return builder().dialect(Dialect.detect(dataSource)).build();
    }

    public Dialect dialect() {
        return dialect;
    }

    public TableNames tableNames() {
        return tableNames;
    }

    public RawEventStore rawEvents() {
        return rawEvents;
    }

    public MeetingStore meetings() {
        return meetings;
    }

    public TranscriptStore transcripts() {
        return transcripts;
    }

    public WebhookFailureStore webhookFailures() {
        return webhookFailures;
    }

    public DeadLetterStore deadLetters() {
        return deadLetters;
    }

    /**
     * Builder for {@link JdbcStores}.
     */
    public static final class Builder {
        private Dialect dialect;
        private TableNames tableNames;
        private JsonCodec jsonCodec;

        private Builder() {
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder dialect(Dialect dialect) {
            this.dialect = dialect;
            return this;
        }

        /**
         * Optional. Defaults to {@link TableNames#DEFAULTS}.
         */
        public Builder tableNames(TableNames tableNames) {
            this.tableNames = tableNames;
            return this;
        }

        /**
         * Sets the codec for the JSON columns (logs, segments, failure history).
         *
         * <p>Optional. Defaults to {@link JsonCodec#getDefault()}.
         */
        public Builder jsonCodec(JsonCodec jsonCodec) {
            this.jsonCodec = jsonCodec;
            return this;
        }

        public JdbcStores build() {
            return new JdbcStores(this);
        }
    }
}
