package io.workflow;

import java.time.Duration;
import java.util.Objects;

/**
 * Outbound intent produced by {@link Workflow#decide}.
 *
 * <p>Commands are data only: the engine records them in the workflow log and a
 * {@link io.workflow.dispatch.CommandDispatcher} later hands them to whatever
 * transport the host registers. Every command has a matching {@link WorkflowEvent}
 * produced by {@link WorkflowTranslator}.
 *
 * <p>Match on {@link #kind()} with a switch expression to get exhaustiveness checks
 * from the compiler.
 *
 * @param <O> type of outgoing payloads
 */
public sealed interface WorkflowCommand<O>
        permits WorkflowCommand.Reply, WorkflowCommand.Send, WorkflowCommand.Publish,
        WorkflowCommand.Schedule, WorkflowCommand.Complete {

    /**
     * Discriminator for the command variants.
     */
    enum Kind {
        REPLY,
        SEND,
        PUBLISH,
        SCHEDULE,
        COMPLETE
    }

    Kind kind();

    /**
     * Returns the outgoing payload.
     *
     * @throws IllegalStateException for {@link Complete}, which carries none
     */
    default O output() {
        throw new IllegalStateException(kind() + " carries no output");
    }

    static <O> WorkflowCommand<O> reply(O output) {
        return new Reply<>(output);
    }

    static <O> WorkflowCommand<O> send(O output) {
        return new Send<>(output);
    }

    static <O> WorkflowCommand<O> publish(O output) {
        return new Publish<>(output);
    }

    static <O> WorkflowCommand<O> schedule(Duration after, O output) {
        return new Schedule<>(after, output);
    }

    static <O> WorkflowCommand<O> complete() {
        return new Complete<>();
    }

    /** Answer the caller that delivered the current input. */
    record Reply<O>(O output) implements WorkflowCommand<O> {
        public Reply {
            Objects.requireNonNull(output, "output");
        }

        @Override
        public Kind kind() {
            return Kind.REPLY;
        }
    }

    /** Point-to-point message to another party. */
    record Send<O>(O output) implements WorkflowCommand<O> {
        public Send {
            Objects.requireNonNull(output, "output");
        }

        @Override
        public Kind kind() {
            return Kind.SEND;
        }
    }

    /** Broadcast notification. */
    record Publish<O>(O output) implements WorkflowCommand<O> {
        public Publish {
            Objects.requireNonNull(output, "output");
        }

        @Override
        public Kind kind() {
            return Kind.PUBLISH;
        }
    }

    /** Deliver {@code output} after the given delay. */
    record Schedule<O>(Duration after, O output) implements WorkflowCommand<O> {
        public Schedule {
            Objects.requireNonNull(after, "after");
            Objects.requireNonNull(output, "output");
            if (after.isNegative()) {
                throw new IllegalArgumentException("after must be >= 0, got: " + after);
            }
        }

        @Override
        public Kind kind() {
            return Kind.SCHEDULE;
        }
    }

    /** Ends the workflow instance. */
    record Complete<O>() implements WorkflowCommand<O> {
        @Override
        public Kind kind() {
            return Kind.COMPLETE;
        }
    }
}
