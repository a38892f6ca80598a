package io.workflow.model;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One entry of a workflow's append-only log.
 *
 * <p>Entries are created with {@code position = 0}; the store assigns the real position on
 * append and returns copies carrying it from reads. The {@code processed} flag is only
 * meaningful for output commands: the store normalises it to {@code false} for those and to
 * {@code null} for everything else.
 *
 * @param messageId unique id (ULID) of this entry
 * @param workflowId the workflow instance the entry belongs to
 * @param position 1-based position within the workflow, 0 until stored
 * @param kind event or command
 * @param direction input or output
 * @param message the payload, either a {@link io.workflow.WorkflowEvent}, a
 *                {@link io.workflow.WorkflowCommand} or a caller-defined object
 * @param timestamp when the entry was created
 * @param processed dispatch flag for output commands, {@code null} otherwise
 * @param headers free-form metadata such as correlation ids
 */
public record WorkflowMessage(
        String messageId,
        String workflowId,
        long position,
        MessageKind kind,
        MessageDirection direction,
        Object message,
        Instant timestamp,
        Boolean processed,
        Map<String, String> headers) {

    public WorkflowMessage {
        Objects.requireNonNull(messageId, "messageId");
        Objects.requireNonNull(workflowId, "workflowId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(timestamp, "timestamp");
        if (position < 0) {
            throw new IllegalArgumentException("position must be >= 0, got: " + position);
        }
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    /**
     * Creates an unsaved event entry.
     */
    public static WorkflowMessage event(String workflowId, MessageDirection direction, Object message,
            Instant timestamp, Map<String, String> headers) {
        return new WorkflowMessage(newMessageId(), workflowId, 0L, MessageKind.EVENT, direction,
                message, timestamp, null, headers);
    }

    /**
     * Creates an unsaved, unprocessed output command entry.
     */
    public static WorkflowMessage command(String workflowId, Object message, Instant timestamp,
            Map<String, String> headers) {
        return new WorkflowMessage(newMessageId(), workflowId, 0L, MessageKind.COMMAND,
                MessageDirection.OUTPUT, message, timestamp, Boolean.FALSE, headers);
    }

    public static String newMessageId() {
        return UlidCreator.getMonotonicUlid().toString();
    }

    public WorkflowMessage withPosition(long newPosition) {
        return new WorkflowMessage(messageId, workflowId, newPosition, kind, direction, message,
                timestamp, processed, headers);
    }

    public WorkflowMessage withProcessed(Boolean newProcessed) {
        return new WorkflowMessage(messageId, workflowId, position, kind, direction, message,
                timestamp, newProcessed, headers);
    }

    /**
     * Returns the form this entry takes once stored: the given position and a
     * {@code processed} flag that is non-null exactly for output commands.
     */
    public WorkflowMessage normalizedAt(long newPosition) {
        Boolean flag;
        if (isOutputCommand()) {
            flag = processed == null ? Boolean.FALSE : processed;
        } else {
            flag = null;
        }
        return new WorkflowMessage(messageId, workflowId, newPosition, kind, direction, message,
                timestamp, flag, headers);
    }

    public boolean isOutputCommand() {
        return kind == MessageKind.COMMAND && direction == MessageDirection.OUTPUT;
    }

    /**
     * Whether the dispatcher still has to deliver this entry.
     */
    public boolean isPendingCommand() {
        return isOutputCommand() && Boolean.FALSE.equals(processed);
    }

    public boolean isEventForStateEvolution() {
        return kind == MessageKind.EVENT;
    }

    public String header(String name) {
        return headers.get(name);
    }
}
