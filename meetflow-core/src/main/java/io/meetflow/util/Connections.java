package io.meetflow.util;

import io.meetflow.PipelineException;
import io.meetflow.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs store work on a fresh connection, either in auto-commit mode or as one transaction.
 *
 * <p>{@link SQLException}s are rethrown as {@link PipelineException}; runtime exceptions
 * propagate unchanged after rollback.
 */
public final class Connections {
    private static final Logger logger = Logger.getLogger(Connections.class.getName());

    @FunctionalInterface
    public interface SqlWork<T> {
        T execute(Connection conn) throws SQLException;
    }

    private Connections() {
    }

    public static <T> T autoCommit(ConnectionProvider provider, String action, SqlWork<T> work) {
        try (Connection conn = provider.getConnection()) {
            conn.setAutoCommit(true);
            return work.execute(conn);
        } catch (SQLException e) {
            throw new PipelineException("Failed to " + action, e);
        }
    }

    public static <T> T transaction(ConnectionProvider provider, String action, SqlWork<T> work) {
        try (Connection conn = provider.getConnection()) {
            conn.setAutoCommit(false);
            try {
                T result = work.execute(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(conn, action);
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new PipelineException("Failed to " + action, e);
        }
    }

    private static void rollbackQuietly(Connection conn, String action) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            logger.log(Level.WARNING, "Rollback failed while trying to " + action, e);
        }
    }
}
