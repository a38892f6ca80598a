package io.workflow;

/**
 * Thrown by {@link Workflow#decide} or {@link Workflow#evolve} when an (input, state) or
 * (state, event) pair is not part of the workflow's state machine.
 *
 * <p>The offending message and state are kept for diagnostics. They are not included in
 * {@link #getMessage()} beyond their type names, since payloads may be large or sensitive.
 */
public final class UnsupportedTransitionException extends WorkflowException {

    /**
     * Which pure function rejected the pair.
     */
    public enum Stage {
        DECIDE,
        EVOLVE
    }

    private final transient Object offending;
    private final transient Object state;
    private final Stage stage;

    private UnsupportedTransitionException(Stage stage, Object offending, Object state) {
        super(stage + " does not support " + typeName(offending) + " in state " + typeName(state));
        this.stage = stage;
        this.offending = offending;
        this.state = state;
    }

    public static UnsupportedTransitionException forInput(Object input, Object state) {
        return new UnsupportedTransitionException(Stage.DECIDE, input, state);
    }

    public static UnsupportedTransitionException forEvent(WorkflowEvent<?, ?> event, Object state) {
        return new UnsupportedTransitionException(Stage.EVOLVE, event, state);
    }

    public Stage stage() {
        return stage;
    }

    /**
     * The input (for {@link Stage#DECIDE}) or event (for {@link Stage#EVOLVE}) that was rejected.
     */
    public Object offending() {
        return offending;
    }

    public Object state() {
        return state;
    }

    private static String typeName(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof WorkflowEvent<?, ?> event && event.kind().isLifecycle()) {
            return event.kind().name();
        }
        if (value instanceof WorkflowEvent<?, ?> event) {
            return event.kind() + "(" + typeName(event.input()) + ")";
        }
        return value.getClass().getSimpleName();
    }
}
