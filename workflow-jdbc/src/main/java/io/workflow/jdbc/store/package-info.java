/**
 * JDBC-based {@link io.workflow.spi.WorkflowStore} implementations.
 *
 * <p>{@link io.workflow.jdbc.store.AbstractJdbcWorkflowStore} provides shared SQL and row
 * mapping; subclasses supply the database-specific way to create a stream row and to advance
 * its position: H2 (lookup then {@code INSERT}), MySQL ({@code INSERT IGNORE}) and
 * PostgreSQL ({@code ON CONFLICT DO NOTHING} plus {@code UPDATE ... RETURNING}).
 *
 * @see io.workflow.jdbc.store.AbstractJdbcWorkflowStore
 * @see io.workflow.jdbc.store.JdbcWorkflowStores
 */
package io.workflow.jdbc.store;
