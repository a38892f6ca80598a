package io.workflow;

import java.util.List;

/**
 * Decider contract for a single workflow type.
 *
 * <p>All three functions must be pure: no I/O, no clock reads, no mutation of the
 * arguments. State values should be immutable so that replaying the same events
 * always yields an equal state.
 *
 * <h2>Evolve exhaustiveness</h2>
 * Implementations switch on {@link WorkflowEvent.Kind} without a {@code default}
 * branch so that adding a new kind breaks the build instead of silently falling through:
 * <pre>{@code
 * public State evolve(State state, WorkflowEvent<Input, Output> event) {
 *     return switch (event.kind()) {
 *         case INITIATED_BY, RECEIVED -> apply(state, event.input());
 *         case BEGAN, REPLIED, SENT, PUBLISHED, SCHEDULED, COMPLETED -> state;
 *     };
 * }
 * }</pre>
 *
 * @param <I> type of incoming messages
 * @param <S> type of the workflow state
 * @param <O> type of outgoing payloads
 * @see WorkflowOrchestrator
 * @see WorkflowProcessor
 */
public interface Workflow<I, S, O> {

    /**
     * State of a workflow instance before any message has been processed.
     */
    S initialState();

    /**
     * Computes the commands to issue for {@code input} in {@code state}.
     *
     * @param input the incoming message
     * @param state the current state
     * @return commands in issue order, possibly empty
     * @throws UnsupportedTransitionException if the pair is not part of the workflow
     */
    List<WorkflowCommand<O>> decide(I input, S state);

    /**
     * Folds one event into the state.
     *
     * @param state the current state
     * @param event an event produced by {@link #translate}
     * @return the next state
     * @throws UnsupportedTransitionException if the workflow does not know the pair
     */
    S evolve(S state, WorkflowEvent<I, O> event);

    /**
     * Converts a decision into the events recorded for it.
     *
     * @see WorkflowTranslator#translate
     */
    default List<WorkflowEvent<I, O>> translate(boolean begins, I input, List<WorkflowCommand<O>> commands) {
        return WorkflowTranslator.translate(begins, input, commands);
    }
}
