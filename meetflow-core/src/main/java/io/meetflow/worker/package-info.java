/**
 * The background worker and the correlation of raw events to meetings.
 */
package io.meetflow.worker;
