package io.workflow;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Pure Decide, Translate, Evolve pipeline over in-memory snapshots.
 *
 * <p>Use this when the host keeps workflow snapshots itself. {@link WorkflowProcessor}
 * builds on it to rebuild state from, and record results in, a
 * {@link io.workflow.spi.WorkflowStore}.
 *
 * <p>This class is stateless and thread-safe.
 */
public final class WorkflowOrchestrator<I, S, O> {
    private final Workflow<I, S, O> workflow;

    public WorkflowOrchestrator(Workflow<I, S, O> workflow) {
        this.workflow = Objects.requireNonNull(workflow, "workflow");
    }

    public Workflow<I, S, O> workflow() {
        return workflow;
    }

    /**
     * Snapshot of a workflow that has not received any message yet.
     */
    public WorkflowSnapshot<I, S, O> initialSnapshot() {
        return new WorkflowSnapshot<>(workflow.initialState(), List.of());
    }

    /**
     * Processes one input against a snapshot.
     *
     * <p>Decide runs first; its commands are translated to events, which are appended to the
     * snapshot's history and folded into its state. Nothing is mutated: the result carries a
     * new snapshot.
     *
     * @param snapshot current snapshot
     * @param input    the incoming message
     * @param begins   whether {@code input} starts the workflow
     * @throws UnsupportedTransitionException if decide or evolve rejects the input
     */
    public OrchestrationResult<I, S, O> run(WorkflowSnapshot<I, S, O> snapshot, I input, boolean begins) {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(input, "input");

        List<WorkflowCommand<O>> commands = workflow.decide(input, snapshot.state());
        List<WorkflowEvent<I, O>> events = workflow.translate(begins, input, commands);
        S state = fold(snapshot.state(), events);

        List<WorkflowEvent<I, O>> history = new ArrayList<>(snapshot.eventHistory().size() + events.size());
        history.addAll(snapshot.eventHistory());
        history.addAll(events);
        return new OrchestrationResult<>(new WorkflowSnapshot<>(state, history), commands, events);
    }

    /**
     * Folds {@code events} into {@link Workflow#initialState()}.
     */
    public S replay(List<WorkflowEvent<I, O>> events) {
        return fold(workflow.initialState(), events);
    }

    S fold(S state, List<WorkflowEvent<I, O>> events) {
        S current = state;
        for (WorkflowEvent<I, O> event : events) {
            current = workflow.evolve(current, event);
        }
        return current;
    }
}
