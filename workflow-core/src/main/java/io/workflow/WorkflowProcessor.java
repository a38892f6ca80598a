package io.workflow;

import io.workflow.model.MessageDirection;
import io.workflow.model.WorkflowMessage;
import io.workflow.spi.MetricsExporter;
import io.workflow.spi.WorkflowStore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a {@link Workflow} against a {@link WorkflowStore}.
 *
 * <p>For each input the processor rebuilds the current state by replaying the stored events,
 * runs Decide, Translate and Evolve, and appends the resulting events followed by the
 * commands in a single batch. The append happens only after every pure step has succeeded,
 * so a rejected input leaves the log untouched. Commands are stored as pending output
 * entries for a {@link io.workflow.dispatch.CommandDispatcher} to deliver.
 *
 * <p>Payloads are stored as the {@link WorkflowEvent} and {@link WorkflowCommand} objects
 * themselves. Stores that persist outside the JVM need a
 * {@link io.workflow.spi.PayloadCodec} able to round-trip them.
 *
 * <p>Inputs for the same workflow id must not be processed concurrently; the host is
 * responsible for routing them through a single consumer or lock. Different ids may be
 * processed in parallel.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class WorkflowProcessor<I, S, O> {
    private static final Logger logger = Logger.getLogger(WorkflowProcessor.class.getName());

    /** Header linking every entry written for an input to that input's entry. */
    public static final String CAUSATION_ID = "causation-id";

    /** Header carrying the caller's correlation id, defaulted to the workflow id. */
    public static final String CORRELATION_ID = "correlation-id";

    private final WorkflowOrchestrator<I, S, O> orchestrator;
    private final WorkflowStore store;
    private final Clock clock;
    private final MetricsExporter metrics;

    private WorkflowProcessor(Builder<I, S, O> builder) {
        this.orchestrator = new WorkflowOrchestrator<>(Objects.requireNonNull(builder.workflow, "workflow"));
        this.store = Objects.requireNonNull(builder.store, "store");
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    }

    public static <I, S, O> Builder<I, S, O> builder() {
        return new Builder<>();
    }

    public Workflow<I, S, O> workflow() {
        return orchestrator.workflow();
    }

    public WorkflowStore store() {
        return store;
    }

    /**
     * Applies one input to a workflow with no extra metadata.
     *
     * @see #process(String, Object, Map)
     */
    public ProcessingResult<I, S, O> process(String workflowId, I input) {
        return process(workflowId, input, Map.of());
    }

    /**
     * Applies one input to a workflow and records the outcome.
     *
     * <p>The first input for an id starts the workflow ({@code Began, InitiatedBy});
     * later ones are recorded as {@code Received}. {@code headers} are copied onto every entry
     * written; a {@value #CORRELATION_ID} header defaults to the workflow id and a
     * {@value #CAUSATION_ID} header points at the input's entry.
     *
     * @param workflowId the workflow instance
     * @param input      the incoming message
     * @param headers    metadata to store alongside the entries; not passed to decide
     * @return the new state plus what was recorded
     * @throws UnsupportedTransitionException if the workflow rejects the input; nothing is written
     * @throws ReplayInconsistencyException   if the stored history cannot be replayed
     */
    public ProcessingResult<I, S, O> process(String workflowId, I input, Map<String, String> headers) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(headers, "headers");
        if (workflowId == null || workflowId.isBlank()) {
            throw new IllegalArgumentException("workflowId must not be blank");
        }

        WorkflowSnapshot<I, S, O> snapshot = load(workflowId);
        boolean begins = !store.exists(workflowId);

        OrchestrationResult<I, S, O> result = orchestrator.run(snapshot, input, begins);

        List<WorkflowMessage> batch = toMessages(workflowId, result, headers);
        long lastPosition = store.append(workflowId, batch);
        metrics.incrementMessagesAppended(batch.size());

        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Processed " + input.getClass().getSimpleName() + " for workflowId=" + workflowId
                    + (begins ? " (new)" : "") + ": " + result.commands().size() + " command(s), state "
                    + describe(result.state()));
        }
        return new ProcessingResult<>(workflowId, result.state(), result.commands(), result.events(), lastPosition);
    }

    /**
     * Rebuilds the current state of a workflow from its stored events.
     *
     * @return {@link Workflow#initialState()} for an unknown workflow
     * @throws ReplayInconsistencyException if a stored event cannot be applied
     */
    public S currentState(String workflowId) {
        return load(workflowId).state();
    }

    /**
     * Replays the stored events of a workflow into a snapshot.
     *
     * @throws ReplayInconsistencyException if a stored event cannot be applied
     */
    public WorkflowSnapshot<I, S, O> load(String workflowId) {
        Workflow<I, S, O> workflow = orchestrator.workflow();
        S state = workflow.initialState();
        List<WorkflowEvent<I, O>> history = new ArrayList<>();
        for (WorkflowMessage message : store.readStream(workflowId)) {
            if (!message.isEventForStateEvolution()) {
                continue;
            }
            try {
                WorkflowEvent<I, O> event = asEvent(message);
                state = workflow.evolve(state, event);
                history.add(event);
            } catch (RuntimeException e) {
                throw new ReplayInconsistencyException(workflowId, message.position(), e);
            }
        }
        return new WorkflowSnapshot<>(state, history);
    }

    @SuppressWarnings("unchecked")
    private WorkflowEvent<I, O> asEvent(WorkflowMessage message) {
        Object payload = message.message();
        if (!(payload instanceof WorkflowEvent<?, ?>)) {
            throw new ClassCastException("Stored event at position " + message.position()
                    + " is a " + payload.getClass().getName() + ", not a WorkflowEvent");
        }
        return (WorkflowEvent<I, O>) payload;
    }

    private List<WorkflowMessage> toMessages(String workflowId, OrchestrationResult<I, S, O> result,
            Map<String, String> headers) {
        Instant now = clock.instant();
        Map<String, String> base = new HashMap<>(headers);
        base.putIfAbsent(CORRELATION_ID, workflowId);

        List<WorkflowMessage> batch = new ArrayList<>(result.events().size() + result.commands().size());
        Map<String, String> caused = base;
        for (WorkflowEvent<I, O> event : result.events()) {
            MessageDirection direction = event.kind().isInbound() ? MessageDirection.INPUT : MessageDirection.OUTPUT;
            WorkflowMessage message = WorkflowMessage.event(workflowId, direction, event, now, caused);
            batch.add(message);
            if (event.kind() == WorkflowEvent.Kind.INITIATED_BY || event.kind() == WorkflowEvent.Kind.RECEIVED) {
                caused = new HashMap<>(base);
                caused.put(CAUSATION_ID, message.messageId());
            }
        }
        for (WorkflowCommand<O> command : result.commands()) {
            batch.add(WorkflowMessage.command(workflowId, command, now, caused));
        }
        return batch;
    }

    private static String describe(Object state) {
        return state == null ? "null" : state.getClass().getSimpleName();
    }

    /**
     * Builder for {@link WorkflowProcessor}.
     */
    public static final class Builder<I, S, O> {
        private Workflow<I, S, O> workflow;
        private WorkflowStore store;
        private Clock clock;
        private MetricsExporter metrics;

        private Builder() {
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder<I, S, O> workflow(Workflow<I, S, O> workflow) {
            this.workflow = workflow;
            return this;
        }

        /**
         * Sets the log the processor replays from and appends to.
         *
         * <p><b>Required.</b>
         */
        public Builder<I, S, O> store(WorkflowStore store) {
            this.store = store;
            return this;
        }

        /**
         * Sets the clock used to timestamp log entries.
         *
         * <p>Optional. Defaults to {@link Clock#systemUTC()}.
         */
        public Builder<I, S, O> clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         */
        public Builder<I, S, O> metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * @throws NullPointerException if {@code workflow} or {@code store} is null
         */
        public WorkflowProcessor<I, S, O> build() {
            return new WorkflowProcessor<>(this);
        }
    }
}
