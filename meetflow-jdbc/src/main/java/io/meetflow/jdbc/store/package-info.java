/**
 * JDBC implementations of the pipeline stores.
 */
package io.meetflow.jdbc.store;
