package io.workflow.dispatch;

import io.workflow.model.WorkflowMessage;
import io.workflow.spi.MetricsExporter;
import io.workflow.spi.WorkflowStore;
import io.workflow.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Polls a {@link WorkflowStore} for pending output commands, hands each one to its
 * {@link CommandHandler} and acknowledges it with {@link WorkflowStore#markCommandProcessed}.
 *
 * <p>Commands of one workflow are delivered in position order: when a handler fails, the
 * remaining commands of that workflow wait until the failed one succeeds or is parked.
 * Failures are retried with the configured {@link RetryPolicy}; after {@code maxAttempts}
 * the command is parked, meaning this dispatcher stops offering it until restarted. It stays
 * pending in the store so an operator can inspect or replay it.
 *
 * <p>A failing acknowledgement with {@link IllegalStateException} means the log no longer
 * holds the command as pending (deleted workflow, concurrent dispatcher). It is logged and
 * not retried.
 *
 * <p>Create instances via {@link #builder()}. Call {@link #start()} to poll on a daemon thread
 * or drive {@link #dispatchPending()} directly.
 *
 * <p>This class is thread-safe. Dispatch cycles never overlap.
 */
public final class CommandDispatcher implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(CommandDispatcher.class.getName());

    private final WorkflowStore store;
    private final CommandHandlerRegistry handlers;
    private final RetryPolicy retryPolicy;
    private final int maxAttempts;
    private final int batchSize;
    private final long intervalMs;
    private final MetricsExporter metrics;
    private final Clock clock;

    private final Map<String, Attempt> attempts = new ConcurrentHashMap<>();
    private final Set<String> parked = ConcurrentHashMap.newKeySet();

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> pollTask;
    private volatile boolean closed;

    private CommandDispatcher(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "store");
        this.handlers = Objects.requireNonNull(builder.handlers, "handlers");
        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (builder.intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        if (builder.maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        this.batchSize = builder.batchSize;
        this.intervalMs = builder.intervalMs;
        this.maxAttempts = builder.maxAttempts;
        this.retryPolicy = builder.retryPolicy != null
                ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(200, 60_000);
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the scheduled polling loop. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("CommandDispatcher has been closed");
        }
        if (pollTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("workflow-dispatcher-"));
        pollTask = scheduler.scheduleWithFixedDelay(this::poll, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    private void poll() {
        try {
            dispatchPending();
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Dispatch cycle failed", t);
        }
    }

    /**
     * Runs one dispatch cycle over at most {@code batchSize} pending commands.
     *
     * @return the number of commands handled and acknowledged in this cycle
     */
    public synchronized int dispatchPending() {
        if (closed) {
            return 0;
        }
        Instant now = clock.instant();
        Set<String> blocked = new HashSet<>();
        Set<String> seen = new HashSet<>();
        int offered = 0;
        int acknowledged = 0;
        int limit = initialFetchSize();
        boolean firstFetch = true;
        while (true) {
            List<WorkflowMessage> pending = store.pendingCommands(null, limit);
            if (firstFetch) {
                metrics.recordPendingCommands(pending.size());
                metrics.recordOldestLagMs(oldestLagMs(pending, now));
                firstFetch = false;
            }
            for (WorkflowMessage message : pending) {
                if (offered >= batchSize) {
                    break;
                }
                if (!seen.add(message.messageId())) {
                    continue;
                }
                if (parked.contains(message.messageId()) || blocked.contains(message.workflowId())) {
                    continue;
                }
                Attempt attempt = attempts.get(message.messageId());
                if (attempt != null && now.toEpochMilli() < attempt.nextAttemptAtMs) {
                    blocked.add(message.workflowId());
                    continue;
                }
                offered++;
                switch (dispatch(message)) {
                    case ACKNOWLEDGED -> acknowledged++;
                    case FAILED -> blocked.add(message.workflowId());
                    case SKIPPED -> {
                    }
                }
            }
            if (offered >= batchSize) {
                break;
            }
            if (pending.size() < limit) {
                // the whole pending set was seen, so retry state of vanished commands can go
                forgetMissing(pending);
                break;
            }
            if (limit == Integer.MAX_VALUE) {
                break;
            }
            // skipped entries filled the window; widen it to reach commands behind them
            limit = (int) Math.min(Integer.MAX_VALUE, (long) limit * 2);
        }
        return acknowledged;
    }

    private int initialFetchSize() {
        long size = (long) batchSize + parked.size();
        return (int) Math.min(Integer.MAX_VALUE, size);
    }

    private void forgetMissing(List<WorkflowMessage> pending) {
        Set<String> present = new HashSet<>();
        for (WorkflowMessage message : pending) {
            present.add(message.messageId());
        }
        attempts.keySet().retainAll(present);
        parked.retainAll(present);
    }

    private Outcome dispatch(WorkflowMessage message) {
        PendingCommand command = PendingCommand.of(message);
        CommandHandler handler = handlers.handlerFor(command.commandType());
        if (handler == null) {
            park(command, "No handler registered for commandType=" + command.commandType(), null);
            return Outcome.SKIPPED;
        }

        long start = System.nanoTime();
        try {
            handler.handle(command);
        } catch (Exception e) {
            onHandlerFailure(command, e);
            return Outcome.FAILED;
        } finally {
            metrics.recordHandlerDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        }

        try {
            store.markCommandProcessed(command.workflowId(), command.position());
        } catch (IllegalStateException e) {
            attempts.remove(command.messageId());
            logger.log(Level.SEVERE, "Command " + command.idempotencyKey()
                    + " was handled but is no longer pending in the store", e);
            return Outcome.SKIPPED;
        } catch (RuntimeException e) {
            // still pending, so it is offered again on the next cycle
            logger.log(Level.SEVERE, "Failed to acknowledge command " + command.idempotencyKey(), e);
            return Outcome.FAILED;
        }
        attempts.remove(command.messageId());
        metrics.incrementDispatchSuccess();
        return Outcome.ACKNOWLEDGED;
    }

    private void onHandlerFailure(PendingCommand command, Exception failure) {
        Attempt previous = attempts.get(command.messageId());
        int count = previous == null ? 1 : previous.count + 1;
        if (count >= maxAttempts) {
            park(command, "Handler failed " + count + " time(s)", failure);
            return;
        }
        long delayMs = retryPolicy.computeDelayMs(count);
        attempts.put(command.messageId(), new Attempt(count, clock.millis() + delayMs));
        metrics.incrementDispatchFailure();
        logger.log(Level.WARNING, "Handler failed for command " + command.idempotencyKey()
                + " (attempt " + count + "/" + maxAttempts + "), retrying in " + delayMs + " ms", failure);
    }

    private void park(PendingCommand command, String reason, Exception failure) {
        attempts.remove(command.messageId());
        parked.add(command.messageId());
        metrics.incrementDispatchParked();
        logger.log(Level.SEVERE, "Parked command " + command.idempotencyKey() + ": " + reason, failure);
    }

    private static long oldestLagMs(List<WorkflowMessage> pending, Instant now) {
        Instant oldest = null;
        for (WorkflowMessage message : pending) {
            if (oldest == null || message.timestamp().isBefore(oldest)) {
                oldest = message.timestamp();
            }
        }
        return oldest == null ? 0L : Math.max(0L, Duration.between(oldest, now).toMillis());
    }

    /**
     * Number of commands this dispatcher has given up on.
     */
    public int parkedCount() {
        return parked.size();
    }

    /**
     * Number of failed commands waiting for their next attempt.
     */
    public int retryingCount() {
        return attempts.size();
    }

    /**
     * Offers previously parked commands again on the next cycle, with a fresh attempt count.
     */
    public void unparkAll() {
        parked.clear();
    }

    /**
     * Cancels the polling schedule and shuts down the scheduler thread.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private enum Outcome {
        ACKNOWLEDGED,
        FAILED,
        SKIPPED
    }

    private record Attempt(int count, long nextAttemptAtMs) {
    }

    /**
     * Builder for {@link CommandDispatcher}.
     */
    public static final class Builder {
        private WorkflowStore store;
        private CommandHandlerRegistry handlers;
        private RetryPolicy retryPolicy;
        private int maxAttempts = 10;
        private int batchSize = 100;
        private long intervalMs = 1000;
        private MetricsExporter metrics;
        private Clock clock;

        private Builder() {
        }

        /**
         * Sets the store polled for pending commands.
         *
         * <p><b>Required.</b>
         *
         * @param store the workflow log
         * @return this builder
         */
        public Builder store(WorkflowStore store) {
            this.store = store;
            return this;
        }

        /**
         * Sets the handlers commands are routed to.
         *
         * <p><b>Required.</b>
         *
         * @param handlers the routing table
         * @return this builder
         */
        public Builder handlers(CommandHandlerRegistry handlers) {
            this.handlers = handlers;
            return this;
        }

        /**
         * Sets the delay strategy between failed attempts.
         *
         * <p>Optional. Defaults to exponential backoff from 200 ms up to 60 s.
         *
         * @param retryPolicy the retry policy
         * @return this builder
         */
        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        /**
         * Sets how many times a handler may fail for one command before it is parked.
         *
         * <p>Optional. Defaults to {@code 10}. Must be &gt; 0.
         *
         * @param maxAttempts attempts per command
         * @return this builder
         */
        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * Sets the maximum number of commands offered to handlers per cycle.
         *
         * <p>Optional. Defaults to {@code 100}. Must be &gt; 0.
         *
         * @param batchSize commands per cycle
         * @return this builder
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Sets the delay between the end of one cycle and the start of the next.
         *
         * <p>Optional. Defaults to {@code 1000} ms. Must be &gt; 0.
         *
         * @param intervalMs polling interval in milliseconds
         * @return this builder
         */
        public Builder intervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets the clock used for lag and retry timing.
         *
         * <p>Optional. Defaults to {@link Clock#systemUTC()}.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * @throws NullPointerException     if {@code store} or {@code handlers} is null
         * @throws IllegalArgumentException if {@code batchSize}, {@code intervalMs} or
         *                                  {@code maxAttempts} is not positive
         */
        public CommandDispatcher build() {
            return new CommandDispatcher(this);
        }
    }
}
