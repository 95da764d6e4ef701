/**
 * Typed pipeline entities and the closed sets of statuses and steps they move through.
 *
 * <p>Records are immutable snapshots of persisted rows. Structured sub-entities (processing logs,
 * speaker segments, failure history) are typed here and serialized only by the store layer.
 */
package io.meetflow.model;
