/**
 * Micrometer integration for pipeline metrics.
 *
 * @see io.meetflow.micrometer.MicrometerMetricsExporter
 */
package io.meetflow.micrometer;
