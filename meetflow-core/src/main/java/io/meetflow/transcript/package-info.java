/**
 * Single-attempt transcript acquisition and the per-format parsers.
 *
 * <p>Retry decisions are made by {@link io.meetflow.retry.WebhookFailureQueue}, not here.
 */
package io.meetflow.transcript;
