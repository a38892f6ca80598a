package io.workflow.dispatch;

import io.workflow.WorkflowCommand;
import io.workflow.model.WorkflowMessage;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A stored output command as handed to a {@link CommandHandler}.
 *
 * @param message        the log entry
 * @param commandType    routing key: the {@link WorkflowCommand.Kind} name for engine
 *                       commands, the payload's simple class name otherwise
 * @param idempotencyKey {@code workflowId:commandType:position}, stable across redeliveries
 */
public record PendingCommand(WorkflowMessage message, String commandType, String idempotencyKey) {

    public PendingCommand {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(commandType, "commandType");
        Objects.requireNonNull(idempotencyKey, "idempotencyKey");
    }

    public static PendingCommand of(WorkflowMessage message) {
        String type = commandTypeOf(message.message());
        return new PendingCommand(message, type,
                message.workflowId() + ":" + type + ":" + message.position());
    }

    static String commandTypeOf(Object payload) {
        if (payload instanceof WorkflowCommand<?> command) {
            return command.kind().name();
        }
        return payload.getClass().getSimpleName();
    }

    public String workflowId() {
        return message.workflowId();
    }

    public long position() {
        return message.position();
    }

    public String messageId() {
        return message.messageId();
    }

    public Instant timestamp() {
        return message.timestamp();
    }

    public Map<String, String> headers() {
        return message.headers();
    }

    /**
     * The stored payload, usually a {@link WorkflowCommand}.
     */
    public Object payload() {
        return message.message();
    }

    /**
     * The payload as an engine command.
     *
     * @throws IllegalStateException if the payload is not a {@link WorkflowCommand}
     */
    @SuppressWarnings("unchecked")
    public <O> WorkflowCommand<O> command() {
        if (message.message() instanceof WorkflowCommand<?> command) {
            return (WorkflowCommand<O>) command;
        }
        throw new IllegalStateException("Payload at " + idempotencyKey + " is not a WorkflowCommand");
    }
}
