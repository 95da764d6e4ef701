/**
 * JDBC persistence for the meeting pipeline.
 *
 * <p>{@link io.meetflow.jdbc.JdbcStores} builds every store over one dialect;
 * {@link io.meetflow.jdbc.JdbcSchema} installs the bundled DDL for a
 * {@link io.meetflow.jdbc.Dialect}. A {@code DataSource} serves as the core connection SPI
 * through {@code dataSource::getConnection}.
 */
package io.meetflow.jdbc;
