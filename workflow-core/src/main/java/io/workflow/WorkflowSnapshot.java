package io.workflow;

import java.util.List;
import java.util.Objects;

/**
 * A workflow state together with the events that produced it.
 *
 * @param state        the folded state
 * @param eventHistory every event applied so far, oldest first
 */
public record WorkflowSnapshot<I, S, O>(S state, List<WorkflowEvent<I, O>> eventHistory) {

    public WorkflowSnapshot {
        Objects.requireNonNull(eventHistory, "eventHistory");
        eventHistory = List.copyOf(eventHistory);
    }
}
