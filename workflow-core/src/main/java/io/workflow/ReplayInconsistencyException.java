package io.workflow;

/**
 * Thrown when a workflow's stored events can no longer be folded into a state.
 *
 * <p>This indicates that the workflow definition changed in a way that is incompatible
 * with history already written to the store, as opposed to a live input the workflow does
 * not handle (which surfaces as {@link UnsupportedTransitionException}).
 */
public final class ReplayInconsistencyException extends WorkflowException {
    private final String workflowId;
    private final long position;

    public ReplayInconsistencyException(String workflowId, long position, Throwable cause) {
        super("Cannot replay workflowId=" + workflowId + " at position " + position, cause);
        this.workflowId = workflowId;
        this.position = position;
    }

    public String workflowId() {
        return workflowId;
    }

    /**
     * Position of the stored message that could not be applied.
     */
    public long position() {
        return position;
    }
}
