/**
 * Built-in {@link io.workflow.spi.WorkflowStore} implementations.
 *
 * <p>Database-backed stores live in the {@code workflow-jdbc} module.
 */
package io.workflow.store;
