package io.meetflow.ingest;

import io.meetflow.PipelineException;
import io.meetflow.ingest.platform.PlatformEventAdapters;
import io.meetflow.model.EventHints;
import io.meetflow.model.Platform;
import io.meetflow.model.RawEvent;
import io.meetflow.model.RawEventStatus;
import io.meetflow.spi.ConnectionProvider;
import io.meetflow.spi.MetricsExporter;
import io.meetflow.spi.PlatformEventAdapter;
import io.meetflow.spi.RawEventStore;
import io.meetflow.util.Connections;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable, idempotent handoff of webhook deliveries into the pipeline.
 *
 * <p>A delivery is stored as a {@link RawEvent} in {@code received} status; the worker picks it
 * up by polling. The {@code (platform, externalEventId)} pair is the idempotency key: a repeated
 * delivery returns {@code created=false} with the id of the first row and triggers nothing.
 * No platform call happens on this path.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class EventIngestor {
    private static final Logger logger = Logger.getLogger(EventIngestor.class.getName());

    private final ConnectionProvider connectionProvider;
    private final RawEventStore rawEventStore;
    private final PlatformEventAdapters adapters;
    private final MetricsExporter metrics;
    private final Clock clock;

    private EventIngestor(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.rawEventStore = Objects.requireNonNull(builder.rawEventStore, "rawEventStore");
        this.adapters = builder.adapters != null ? builder.adapters : PlatformEventAdapters.defaults();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Stores one event unless its external id was already seen for the platform.
     *
     * @throws PipelineException if the event could not be stored
     */
    public IngestResult ingest(Platform platform, String eventType, String externalEventId, String payloadJson) {
        Objects.requireNonNull(platform, "platform");
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(externalEventId, "externalEventId");
        Objects.requireNonNull(payloadJson, "payloadJson");

        RawEvent event = new RawEvent(
            UUID.randomUUID().toString(),
            platform,
            eventType,
            externalEventId,
            payloadJson,
            RawEventStatus.RECEIVED,
            hints(platform, eventType, payloadJson),
            null,
            Instant.now(clock),
            null);

        return Connections.autoCommit(connectionProvider, "ingest event " + externalEventId, conn -> {
            if (rawEventStore.insert(conn, event)) {
                metrics.incrementEventsIngested();
                logger.log(Level.FINE, "Stored {0} event {1} as {2}",
                    new Object[]{platform.code(), externalEventId, event.id()});
                return IngestResult.created(event.id(), externalEventId);
            }
            RawEvent existing = rawEventStore.findByExternalId(conn, platform, externalEventId)
                .orElseThrow(() -> new PipelineException(
                    "Duplicate key reported for " + externalEventId + " but no stored event was found"));
            metrics.incrementDuplicateEvents();
            logger.log(Level.INFO, "Duplicate {0} delivery {1} ignored",
                new Object[]{platform.code(), externalEventId});
            return IngestResult.duplicate(existing.id(), externalEventId);
        });
    }

    /**
     * Splits a raw webhook body with the platform's adapter and ingests every event it carries.
     *
     * @throws IllegalArgumentException if the body is not a valid payload for the platform
     */
    public List<IngestResult> ingestDelivery(Platform platform, String body) {
        Objects.requireNonNull(platform, "platform");
        List<PlatformEventAdapter.InboundEvent> events = adapters.forPlatform(platform).split(body);
        List<IngestResult> results = new ArrayList<>(events.size());
        for (PlatformEventAdapter.InboundEvent event : events) {
            results.add(ingest(platform, event.eventType(), event.externalEventId(), event.payloadJson()));
        }
        return results;
    }

    private EventHints hints(Platform platform, String eventType, String payloadJson) {
        try {
            return adapters.forPlatform(platform).extractHints(eventType, payloadJson);
        } catch (RuntimeException e) {
            // hints are advisory; the payload is still stored for audit
            logger.log(Level.WARNING, "Could not extract hints from " + platform.code() + " " + eventType, e);
            return EventHints.NONE;
        }
    }

    /**
     * Builder for {@link EventIngestor}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private RawEventStore rawEventStore;
        private PlatformEventAdapters adapters;
        private MetricsExporter metrics;
        private Clock clock;

        private Builder() {
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder rawEventStore(RawEventStore rawEventStore) {
            this.rawEventStore = rawEventStore;
            return this;
        }

        /**
         * Optional. Defaults to {@link PlatformEventAdapters#defaults()}.
         */
        public Builder adapters(PlatformEventAdapters adapters) {
            this.adapters = adapters;
            return this;
        }

        /**
         * Optional. Defaults to {@link MetricsExporter#NOOP}.
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Optional. Defaults to the UTC system clock.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public EventIngestor build() {
            return new EventIngestor(this);
        }
    }
}
