package io.meetflow.spi;

import io.meetflow.model.DeadLetter;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for dead letters. Rows are never deleted.
 */
public interface DeadLetterStore {

    void insert(Connection conn, DeadLetter deadLetter);

    Optional<DeadLetter> findById(Connection conn, String id);

    Optional<DeadLetter> findByFailureId(Connection conn, String webhookFailureId);

    /**
     * Returns unresolved dead letters, oldest first.
     */
    List<DeadLetter> findUnresolved(Connection conn, int limit);

    /**
     * Returns dead letters whose alert has not been delivered, oldest first.
     */
    List<DeadLetter> findPendingAlerts(Connection conn, int limit);

    int markAlertSent(Connection conn, String id);

    /**
     * Resolves an unresolved dead letter.
     *
     * @return rows updated (0 if unknown or already resolved)
     */
    int resolve(Connection conn, String id, String notes, Instant resolvedAt);

    long countUnresolved(Connection conn);
}
