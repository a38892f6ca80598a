package io.workflow.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.workflow.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code workflow.messages.appended}: log entries written by the processor</li>
 *   <li>{@code workflow.dispatch.success}: commands handled and acknowledged</li>
 *   <li>{@code workflow.dispatch.failure}: handler failures that will be retried</li>
 *   <li>{@code workflow.dispatch.parked}: commands given up on</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code workflow.commands.pending}: pending commands seen by the last dispatch cycle</li>
 *   <li>{@code workflow.commands.lag.oldest.ms}: age of the oldest pending command</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code workflow.dispatch.handler.duration.ms}: command handler execution time</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final Counter messagesAppended;
    private final Counter dispatchSuccess;
    private final Counter dispatchFailure;
    private final Counter dispatchParked;
    private final Gauge pendingGauge;
    private final Gauge lagGauge;
    private final DistributionSummary handlerDuration;

    private final AtomicInteger pendingCommands = new AtomicInteger();
    private final AtomicLong oldestLagMs = new AtomicLong();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "workflow"}.
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "workflow");
    }

    /**
     * Creates an exporter with a custom metric name prefix, for hosts running several engines.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "orders.workflow"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.messagesAppended = Counter.builder(namePrefix + ".messages.appended")
                .description("Log entries appended by the processor")
                .register(registry);
        this.dispatchSuccess = Counter.builder(namePrefix + ".dispatch.success")
                .description("Commands handled and acknowledged")
                .register(registry);
        this.dispatchFailure = Counter.builder(namePrefix + ".dispatch.failure")
                .description("Command handler failures (will retry)")
                .register(registry);
        this.dispatchParked = Counter.builder(namePrefix + ".dispatch.parked")
                .description("Commands parked after the last attempt or without a handler")
                .register(registry);

        this.pendingGauge = Gauge.builder(namePrefix + ".commands.pending", pendingCommands, AtomicInteger::get)
                .register(registry);
        this.lagGauge = Gauge.builder(namePrefix + ".commands.lag.oldest.ms", oldestLagMs, AtomicLong::get)
                .register(registry);

        this.handlerDuration = DistributionSummary.builder(namePrefix + ".dispatch.handler.duration.ms")
                .description("Command handler execution time in milliseconds")
                .register(registry);
    }

    @Override
    public void incrementMessagesAppended(int count) {
        if (closed) return;
        messagesAppended.increment(count);
    }

    @Override
    public void incrementDispatchSuccess() {
        if (closed) return;
        dispatchSuccess.increment();
    }

    @Override
    public void incrementDispatchFailure() {
        if (closed) return;
        dispatchFailure.increment();
    }

    @Override
    public void incrementDispatchParked() {
        if (closed) return;
        dispatchParked.increment();
    }

    @Override
    public void recordPendingCommands(int pending) {
        if (closed) return;
        pendingCommands.set(pending);
    }

    @Override
    public void recordOldestLagMs(long lagMs) {
        if (closed) return;
        oldestLagMs.set(lagMs);
    }

    @Override
    public void recordHandlerDurationMs(long durationMs) {
        if (closed) return;
        handlerDuration.record(durationMs);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(messagesAppended, dispatchSuccess, dispatchFailure, dispatchParked,
                pendingGauge, lagGauge, handlerDuration)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
