package io.meetflow.spi;

import io.meetflow.model.Platform;
import io.meetflow.model.RawEvent;
import io.meetflow.model.RawEventStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for inbound webhook deliveries.
 *
 * <p>All methods use the caller's connection and never commit or close it.
 */
public interface RawEventStore {

    /**
     * Inserts a new event.
     *
     * @return {@code false} if an event with the same {@code (platform, externalEventId)} already
     *         exists, in which case nothing was written
     */
    boolean insert(Connection conn, RawEvent event);

    Optional<RawEvent> findById(Connection conn, String id);

    Optional<RawEvent> findByExternalId(Connection conn, Platform platform, String externalEventId);

    /**
     * Returns events in {@link RawEventStatus#RECEIVED}, oldest first.
     */
    List<RawEvent> pollReceived(Connection conn, int limit);

    /**
     * Moves an event from {@code from} to {@code to} if it is still in {@code from}.
     *
     * @param errorMessage stored error, or {@code null} to clear it
     * @param processedAt  completion time, or {@code null} to leave it unset
     * @return rows updated (0 if the event was not in {@code from})
     */
    int transition(Connection conn, String id, RawEventStatus from, RawEventStatus to,
                   String errorMessage, Instant processedAt);

    int countByStatus(Connection conn, RawEventStatus status);
}
