package io.workflow.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by
 * {@link io.workflow.jdbc.store.AbstractJdbcWorkflowStore} and its subclasses.
 */
public final class WorkflowStoreException extends RuntimeException {
    public WorkflowStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
