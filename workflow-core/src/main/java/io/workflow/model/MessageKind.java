package io.workflow.model;

/**
 * Whether a log entry is a recorded fact or an outbound intent.
 */
public enum MessageKind {
    /** Folded by evolve when rebuilding state. */
    EVENT,
    /** Picked up by the dispatcher when it is an unprocessed output. */
    COMMAND
}
