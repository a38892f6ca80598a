package io.workflow.spring.boot;

import io.workflow.WorkflowProcessor;
import io.workflow.dispatch.CommandDispatcher;
import io.workflow.dispatch.CommandHandlerRegistry;
import io.workflow.dispatch.ExponentialBackoffRetryPolicy;
import io.workflow.jdbc.TableNames;
import io.workflow.jdbc.store.JdbcWorkflowStores;
import io.workflow.spi.MetricsExporter;
import io.workflow.spi.PayloadCodec;
import io.workflow.spi.WorkflowStore;
import io.workflow.store.InMemoryWorkflowStore;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.util.logging.Logger;

/**
 * Auto-configuration for the workflow engine.
 *
 * <p>Provides a {@link WorkflowStore} (JDBC when a {@link DataSource} is available, in-memory
 * otherwise, see {@link WorkflowProperties#getStore()}), a {@link CommandHandlerRegistry} fed by
 * {@link WorkflowCommandHandler} beans, a {@link WorkflowProcessorFactory} and a polling
 * {@link CommandDispatcher}.
 *
 * @see WorkflowProperties
 * @see WorkflowMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(WorkflowProcessor.class)
@EnableConfigurationProperties(WorkflowProperties.class)
public class WorkflowAutoConfiguration {
    private static final Logger logger = Logger.getLogger(WorkflowAutoConfiguration.class.getName());

    @Bean
    @ConditionalOnMissingBean
    public WorkflowStore workflowStore(WorkflowProperties props,
                                       ObjectProvider<DataSource> dataSourceProvider,
                                       ObjectProvider<PayloadCodec> payloadCodecProvider) {
        DataSource dataSource = dataSourceProvider.getIfUnique();
        WorkflowProperties.StoreType type = props.getStore();
        if (type == WorkflowProperties.StoreType.AUTO) {
            type = dataSource != null ? WorkflowProperties.StoreType.JDBC : WorkflowProperties.StoreType.IN_MEMORY;
        }
        return switch (type) {
            case IN_MEMORY -> {
                logger.info("Using in-memory workflow store");
                yield new InMemoryWorkflowStore();
            }
            case JDBC -> {
                if (dataSource == null) {
                    throw new IllegalStateException("workflow.store=JDBC requires a single DataSource bean");
                }
                PayloadCodec codec = payloadCodecProvider.getIfAvailable(PayloadCodec::strings);
                TableNames tables = new TableNames(props.getJdbc().getStreamTable(), props.getJdbc().getMessageTable());
                var store = JdbcWorkflowStores.detect(dataSource, codec).withTableNames(tables);
                logger.info("Using JDBC workflow store '" + store.name() + "' with tables " + tables);
                yield store;
            }
            case AUTO -> throw new IllegalStateException("Unresolved store type");
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public CommandHandlerRegistry commandHandlerRegistry() {
        return new CommandHandlerRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowCommandHandlerRegistrar workflowCommandHandlerRegistrar(
            ListableBeanFactory beanFactory, CommandHandlerRegistry registry) {
        return new WorkflowCommandHandlerRegistrar(beanFactory, registry);
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowProcessorFactory workflowProcessorFactory(WorkflowStore store,
                                                             ObjectProvider<MetricsExporter> metricsProvider) {
        return new WorkflowProcessorFactory(store, metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP));
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "workflow.dispatcher", name = "enabled", matchIfMissing = true)
    public CommandDispatcher commandDispatcher(WorkflowProperties props,
                                               WorkflowStore store,
                                               CommandHandlerRegistry handlers,
                                               ObjectProvider<MetricsExporter> metricsProvider) {
        WorkflowProperties.Dispatcher dispatcher = props.getDispatcher();
        return CommandDispatcher.builder()
                .store(store)
                .handlers(handlers)
                .retryPolicy(new ExponentialBackoffRetryPolicy(
                        props.getRetry().getBaseDelayMs(), props.getRetry().getMaxDelayMs()))
                .maxAttempts(dispatcher.getMaxAttempts())
                .batchSize(dispatcher.getBatchSize())
                .intervalMs(dispatcher.getIntervalMs())
                .metrics(metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP))
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "workflow.dispatcher", name = "enabled", matchIfMissing = true)
    public CommandDispatcherLifecycle commandDispatcherLifecycle(CommandDispatcher dispatcher) {
        return new CommandDispatcherLifecycle(dispatcher);
    }
}
