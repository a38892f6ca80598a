package io.workflow.dispatch;

import io.workflow.WorkflowCommand;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe routing table from command type to {@link CommandHandler}.
 *
 * <p>Each command type maps to exactly one handler. Commands whose type has no handler go to
 * the fallback handler if one is set; otherwise the dispatcher parks them.
 *
 * <pre>{@code
 * CommandHandlerRegistry registry = new CommandHandlerRegistry()
 *     .register(WorkflowCommand.Kind.SEND, command -> bus.send(command.command().output()))
 *     .register(WorkflowCommand.Kind.SCHEDULE, scheduler::schedule)
 *     .fallback(command -> logger.info("ignored " + command.idempotencyKey()));
 * }</pre>
 */
public final class CommandHandlerRegistry {
    private final Map<String, CommandHandler> handlers = new ConcurrentHashMap<>();
    private volatile CommandHandler fallback;

    public CommandHandlerRegistry register(WorkflowCommand.Kind kind, CommandHandler handler) {
        return register(kind.name(), handler);
    }

    /**
     * Registers a handler for a command type name.
     *
     * @throws IllegalStateException if the type already has a handler
     */
    public CommandHandlerRegistry register(String commandType, CommandHandler handler) {
        Objects.requireNonNull(commandType, "commandType");
        Objects.requireNonNull(handler, "handler");
        CommandHandler existing = handlers.putIfAbsent(commandType, handler);
        if (existing != null) {
            throw new IllegalStateException("Duplicate handler for commandType=" + commandType);
        }
        return this;
    }

    /**
     * Sets the handler used for command types without a dedicated handler.
     *
     * @throws IllegalStateException if a fallback handler is already set
     */
    public synchronized CommandHandlerRegistry fallback(CommandHandler handler) {
        Objects.requireNonNull(handler, "handler");
        if (fallback != null) {
            throw new IllegalStateException("Duplicate fallback handler");
        }
        this.fallback = handler;
        return this;
    }

    /**
     * @return the handler for {@code commandType}, the fallback, or {@code null}
     */
    public CommandHandler handlerFor(String commandType) {
        CommandHandler handler = handlers.get(commandType);
        return handler != null ? handler : fallback;
    }
}
