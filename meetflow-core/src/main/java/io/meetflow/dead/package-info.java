/**
 * Dead-letter promotion, operator resolution, alerting and replay.
 */
package io.meetflow.dead;
