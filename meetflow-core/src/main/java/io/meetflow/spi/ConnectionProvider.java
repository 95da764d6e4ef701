package io.meetflow.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Source of JDBC connections for the pipeline facades and the worker.
 *
 * <p>Callers close the returned connection.
 */
public interface ConnectionProvider {

    Connection getConnection() throws SQLException;
}
