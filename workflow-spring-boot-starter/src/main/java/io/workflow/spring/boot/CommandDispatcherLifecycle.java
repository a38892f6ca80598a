package io.workflow.spring.boot;

import io.workflow.dispatch.CommandDispatcher;
import org.springframework.context.SmartLifecycle;

import java.util.Objects;

/**
 * Starts the {@link CommandDispatcher} once the context is refreshed, so annotated handlers are
 * registered before the first poll, and closes it on shutdown.
 *
 * <p>A closed dispatcher cannot be restarted.
 */
public class CommandDispatcherLifecycle implements SmartLifecycle {
    private final CommandDispatcher dispatcher;
    private volatile boolean running;

    public CommandDispatcherLifecycle(CommandDispatcher dispatcher) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    @Override
    public void start() {
        dispatcher.start();
        running = true;
    }

    @Override
    public void stop() {
        dispatcher.close();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
