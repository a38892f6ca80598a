package io.workflow.dispatch;

/**
 * Delivers a pending command to the outside world: a message bus, a scheduler, an HTTP
 * reply channel, and so on.
 *
 * <p>Handlers run synchronously on the dispatcher thread. Returning normally acknowledges
 * the command, which is then marked processed in the store. Throwing schedules a retry.
 *
 * <h2>Idempotency</h2>
 * Delivery is at-least-once: a crash between the handler returning and the acknowledgement
 * being stored causes the command to be handed over again. Pass
 * {@link PendingCommand#idempotencyKey()} to the downstream system so it can drop duplicates.
 *
 * @see CommandHandlerRegistry
 */
@FunctionalInterface
public interface CommandHandler {

    void handle(PendingCommand command) throws Exception;
}
