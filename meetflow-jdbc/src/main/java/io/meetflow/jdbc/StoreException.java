package io.meetflow.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by {@link JdbcTemplate} and the JDBC stores.
 */
public final class StoreException extends RuntimeException {
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
