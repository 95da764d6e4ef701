package io.meetflow.model;

import java.time.Instant;

/**
 * One inbound webhook delivery, stored verbatim for idempotency and audit.
 *
 * <p>{@code (platform, externalEventId)} is unique. Rows are never deleted.
 */
public record RawEvent(
    String id,
    Platform platform,
    String eventType,
    String externalEventId,
    String payloadJson,
    RawEventStatus status,
    EventHints hints,
    String errorMessage,
    Instant receivedAt,
    Instant processedAt
) {}
