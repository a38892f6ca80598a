package io.workflow.spi;

import io.workflow.model.WorkflowMessage;

import java.util.List;

/**
 * Append-only, position-ordered log of events and commands, one stream per workflow id.
 *
 * <p>Implementations must be safe for concurrent use. Appends to the same workflow id are
 * serialised so that positions stay gapless and unique; appends to different ids must not
 * block each other on a shared lock.
 *
 * <p>Argument errors ({@code null} or blank ids, empty batches) raise
 * {@link IllegalArgumentException} or {@link NullPointerException}. State errors on
 * {@link #markCommandProcessed} raise {@link IllegalStateException}. Backend failures are
 * reported as implementation-specific unchecked exceptions.
 *
 * @see io.workflow.store.InMemoryWorkflowStore
 */
public interface WorkflowStore {

    /**
     * Appends messages to a workflow's stream as one unit.
     *
     * <p>The messages receive consecutive positions starting at the stream's current maximum
     * plus one (1 for a new stream), in list order. Either every message is stored or none is.
     *
     * @param workflowId the target workflow
     * @param messages   at least one message; each must carry {@code workflowId}
     * @return the position assigned to the last message
     * @throws IllegalArgumentException if {@code workflowId} is blank, {@code messages} is empty,
     *                                  or a message belongs to a different workflow
     */
    long append(String workflowId, List<WorkflowMessage> messages);

    /**
     * Reads the whole stream of a workflow.
     *
     * @return messages in ascending position order; empty for an unknown workflow
     */
    default List<WorkflowMessage> readStream(String workflowId) {
        return readStream(workflowId, 1L);
    }

    /**
     * Reads the messages of a workflow with {@code position >= fromPosition}.
     *
     * @return messages in ascending position order; empty for an unknown workflow
     */
    List<WorkflowMessage> readStream(String workflowId, long fromPosition);

    /**
     * Returns every output command that has not been marked processed.
     *
     * <p>Within one workflow the result is in position order. The result is a consistent
     * snapshot: later appends or acknowledgements do not change it.
     *
     * @param workflowId restricts the result to one workflow, or {@code null} for all
     */
    default List<WorkflowMessage> pendingCommands(String workflowId) {
        return pendingCommands(workflowId, Integer.MAX_VALUE);
    }

    /**
     * Like {@link #pendingCommands(String)} but returns at most {@code limit} entries.
     *
     * @throws IllegalArgumentException if {@code limit <= 0}
     */
    List<WorkflowMessage> pendingCommands(String workflowId, int limit);

    /**
     * Marks the output command at {@code position} as processed.
     *
     * @throws IllegalStateException if the workflow is unknown, no message has that position,
     *                               or the message is not an unprocessed output command.
     *                               The store is left unchanged in all of these cases.
     */
    void markCommandProcessed(String workflowId, long position);

    /**
     * Whether any message has been appended for the workflow (and not deleted since).
     */
    boolean exists(String workflowId);

    /**
     * Removes the entire stream of a workflow. Deleting an unknown workflow is a no-op.
     * A later append to the same id starts again at position 1.
     */
    void delete(String workflowId);
}
