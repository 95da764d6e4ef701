/**
 * Retry queue for failed pipeline steps and the backoff policies that schedule it.
 */
package io.meetflow.retry;
