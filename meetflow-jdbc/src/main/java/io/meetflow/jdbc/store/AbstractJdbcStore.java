package io.meetflow.jdbc.store;

import io.meetflow.jdbc.Dialect;
import io.meetflow.jdbc.TableNames;
import io.meetflow.util.JsonCodec;

import java.util.Objects;

/**
 * State shared by the JDBC stores: the dialect, the table names and the codec used for JSON
 * columns.
 *
 * <p>Stores hold no connection state; every method uses the caller's connection and never
 * commits or closes it.
 */
public abstract class AbstractJdbcStore {
    protected static final int MAX_ERROR_LENGTH = 4000;

    private final Dialect dialect;
    private final TableNames tables;
    private final JsonCodec jsonCodec;

    protected AbstractJdbcStore(Dialect dialect, TableNames tables, JsonCodec jsonCodec) {
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        this.tables = Objects.requireNonNull(tables, "tables");
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    }

    protected Dialect dialect() {
        return dialect;
    }

    protected TableNames tables() {
        return tables;
    }

    protected JsonCodec jsonCodec() {
        return jsonCodec;
    }

    protected static String truncateError(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
    }
}
