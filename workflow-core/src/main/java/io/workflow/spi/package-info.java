/**
 * Service provider interfaces for plugging in storage, connections, payload encoding
 * and metrics.
 *
 * <ul>
 *   <li>{@link io.workflow.spi.WorkflowStore} - the per-workflow event and command log</li>
 *   <li>{@link io.workflow.spi.ConnectionProvider} - JDBC connections for database stores</li>
 *   <li>{@link io.workflow.spi.PayloadCodec} - text encoding of payloads for database stores</li>
 *   <li>{@link io.workflow.spi.MetricsExporter} - counters and gauges</li>
 * </ul>
 */
package io.workflow.spi;
