package io.workflow;

import java.time.Duration;
import java.util.Objects;

/**
 * Fact recorded in a workflow's log and folded by {@link Workflow#evolve}.
 *
 * <p>{@link Began}, {@link InitiatedBy} and {@link Received} describe the input that
 * triggered a decision; the remaining variants mirror the commands that decision
 * produced. A workflow's evolve function must accept every kind listed in {@link Kind}.
 *
 * @param <I> type of incoming messages
 * @param <O> type of outgoing payloads
 */
public sealed interface WorkflowEvent<I, O>
        permits WorkflowEvent.Began, WorkflowEvent.InitiatedBy, WorkflowEvent.Received,
        WorkflowEvent.Replied, WorkflowEvent.Sent, WorkflowEvent.Published,
        WorkflowEvent.Scheduled, WorkflowEvent.Completed {

    /**
     * Discriminator for the event variants.
     */
    enum Kind {
        BEGAN,
        INITIATED_BY,
        RECEIVED,
        REPLIED,
        SENT,
        PUBLISHED,
        SCHEDULED,
        COMPLETED;

        /**
         * Whether this kind only marks lifecycle progress and carries no domain input.
         * Evolve implementations usually return the state unchanged for these.
         */
        public boolean isLifecycle() {
            return this != INITIATED_BY && this != RECEIVED;
        }

        /**
         * Whether events of this kind describe the input side of a decision.
         */
        public boolean isInbound() {
            return this == BEGAN || this == INITIATED_BY || this == RECEIVED;
        }
    }

    Kind kind();

    /**
     * Returns the triggering input.
     *
     * @throws IllegalStateException unless this is {@link InitiatedBy} or {@link Received}
     */
    default I input() {
        throw new IllegalStateException(kind() + " carries no input");
    }

    /**
     * Returns the outgoing payload.
     *
     * @throws IllegalStateException unless this is replied, sent, published or scheduled
     */
    default O output() {
        throw new IllegalStateException(kind() + " carries no output");
    }

    record Began<I, O>() implements WorkflowEvent<I, O> {
        @Override
        public Kind kind() {
            return Kind.BEGAN;
        }
    }

    record InitiatedBy<I, O>(I input) implements WorkflowEvent<I, O> {
        public InitiatedBy {
            Objects.requireNonNull(input, "input");
        }

        @Override
        public Kind kind() {
            return Kind.INITIATED_BY;
        }
    }

    record Received<I, O>(I input) implements WorkflowEvent<I, O> {
        public Received {
            Objects.requireNonNull(input, "input");
        }

        @Override
        public Kind kind() {
            return Kind.RECEIVED;
        }
    }

    record Replied<I, O>(O output) implements WorkflowEvent<I, O> {
        public Replied {
            Objects.requireNonNull(output, "output");
        }

        @Override
        public Kind kind() {
            return Kind.REPLIED;
        }
    }

    record Sent<I, O>(O output) implements WorkflowEvent<I, O> {
        public Sent {
            Objects.requireNonNull(output, "output");
        }

        @Override
        public Kind kind() {
            return Kind.SENT;
        }
    }

    record Published<I, O>(O output) implements WorkflowEvent<I, O> {
        public Published {
            Objects.requireNonNull(output, "output");
        }

        @Override
        public Kind kind() {
            return Kind.PUBLISHED;
        }
    }

    record Scheduled<I, O>(Duration after, O output) implements WorkflowEvent<I, O> {
        public Scheduled {
            Objects.requireNonNull(after, "after");
            Objects.requireNonNull(output, "output");
        }

        @Override
        public Kind kind() {
            return Kind.SCHEDULED;
        }
    }

    record Completed<I, O>() implements WorkflowEvent<I, O> {
        @Override
        public Kind kind() {
            return Kind.COMPLETED;
        }
    }
}
