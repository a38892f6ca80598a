package io.workflow.spi;

/**
 * Observability hook for exporting workflow counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards everything. Implement this interface to bridge into
 * Micrometer or another monitoring system.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Adds to the count of log entries appended by the processor.
     *
     * @param count number of entries in the appended batch
     */
    void incrementMessagesAppended(int count);

    /**
     * Increments the count of commands handled and acknowledged.
     */
    void incrementDispatchSuccess();

    /**
     * Increments the count of handler failures that will be retried.
     */
    void incrementDispatchFailure();

    /**
     * Increments the count of commands given up on after the last attempt.
     */
    void incrementDispatchParked();

    /**
     * Records how many pending commands the last dispatch cycle saw.
     */
    default void recordPendingCommands(int pending) {
    }

    /**
     * Records the age (in milliseconds) of the oldest pending command.
     *
     * @param lagMs lag in milliseconds (always non-negative)
     */
    void recordOldestLagMs(long lagMs);

    /**
     * Records the time spent inside a command handler.
     */
    default void recordHandlerDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementMessagesAppended(int count) {
        }

        @Override
        public void incrementDispatchSuccess() {
        }

        @Override
        public void incrementDispatchFailure() {
        }

        @Override
        public void incrementDispatchParked() {
        }

        @Override
        public void recordOldestLagMs(long lagMs) {
        }
    }
}
