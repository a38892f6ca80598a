/**
 * Micrometer bridge for workflow metrics.
 *
 * @see io.workflow.micrometer.MicrometerMetricsExporter
 */
package io.workflow.micrometer;
