package io.workflow.spring.boot;

import io.workflow.Workflow;
import io.workflow.WorkflowProcessor;
import io.workflow.spi.MetricsExporter;
import io.workflow.spi.WorkflowStore;

import java.util.Objects;

/**
 * Creates {@link WorkflowProcessor}s that share the application's store and metrics.
 *
 * <pre>{@code
 * @Bean
 * WorkflowProcessor<OrderInput, OrderState, OrderOutput> orders(WorkflowProcessorFactory factory) {
 *     return factory.create(new OrderWorkflow());
 * }
 * }</pre>
 */
public class WorkflowProcessorFactory {
    private final WorkflowStore store;
    private final MetricsExporter metrics;

    public WorkflowProcessorFactory(WorkflowStore store, MetricsExporter metrics) {
        this.store = Objects.requireNonNull(store, "store");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public <I, S, O> WorkflowProcessor<I, S, O> create(Workflow<I, S, O> workflow) {
        return WorkflowProcessor.<I, S, O>builder()
                .workflow(workflow)
                .store(store)
                .metrics(metrics)
                .build();
    }

    public WorkflowStore store() {
        return store;
    }
}
