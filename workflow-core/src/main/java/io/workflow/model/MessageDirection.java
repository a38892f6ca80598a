package io.workflow.model;

/**
 * Whether a log entry entered the workflow or was produced by it.
 */
public enum MessageDirection {
    INPUT,
    OUTPUT
}
