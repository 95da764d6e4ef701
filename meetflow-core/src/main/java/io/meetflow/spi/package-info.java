/**
 * Service provider interfaces.
 *
 * <p>Store interfaces take an explicit {@link java.sql.Connection}; facades in the other
 * packages own connection and transaction handling. The remaining interfaces are the external
 * collaborators the pipeline talks to: platform payload adapters, the transcript download,
 * the draft-generation trigger, dead-letter alerting, tokens, and metrics.
 */
package io.meetflow.spi;
