/**
 * Delivery of recorded output commands.
 *
 * <p>{@link io.workflow.dispatch.CommandDispatcher} pulls pending commands from a
 * {@link io.workflow.spi.WorkflowStore}, routes them through a
 * {@link io.workflow.dispatch.CommandHandlerRegistry} and acknowledges them once the handler
 * returns. Failed deliveries are retried per {@link io.workflow.dispatch.RetryPolicy}.
 */
package io.workflow.dispatch;
