/**
 * Log entry types persisted by {@link io.workflow.spi.WorkflowStore} implementations.
 */
package io.workflow.model;
