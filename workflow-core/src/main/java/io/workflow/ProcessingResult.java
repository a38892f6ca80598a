package io.workflow;

import java.util.List;

/**
 * Outcome of {@link WorkflowProcessor#process}.
 *
 * @param workflowId   the workflow the input was applied to
 * @param state        the state after the input
 * @param commands     the commands recorded as pending
 * @param events       the events recorded for the input
 * @param lastPosition the position of the last log entry written
 */
public record ProcessingResult<I, S, O>(
        String workflowId,
        S state,
        List<WorkflowCommand<O>> commands,
        List<WorkflowEvent<I, O>> events,
        long lastPosition) {

    public ProcessingResult {
        commands = List.copyOf(commands);
        events = List.copyOf(events);
    }

    /**
     * Whether the input completed the workflow.
     */
    public boolean completed() {
        return commands.stream().anyMatch(c -> c.kind() == WorkflowCommand.Kind.COMPLETE);
    }
}
