package io.workflow;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one {@link WorkflowOrchestrator#run} call.
 *
 * @param snapshot the snapshot after applying {@code events}
 * @param commands the commands returned by decide, in issue order
 * @param events   the events produced for this input only
 */
public record OrchestrationResult<I, S, O>(
        WorkflowSnapshot<I, S, O> snapshot,
        List<WorkflowCommand<O>> commands,
        List<WorkflowEvent<I, O>> events) {

    public OrchestrationResult {
        Objects.requireNonNull(snapshot, "snapshot");
        commands = List.copyOf(commands);
        events = List.copyOf(events);
    }

    public S state() {
        return snapshot.state();
    }
}
