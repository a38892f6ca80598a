package io.workflow.spring.boot;

import io.workflow.jdbc.TableNames;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the workflow engine.
 *
 * @see WorkflowAutoConfiguration
 */
@ConfigurationProperties(prefix = "workflow")
public class WorkflowProperties {

    /**
     * Which store backs the workflow logs.
     */
    private StoreType store = StoreType.AUTO;

    private final Jdbc jdbc = new Jdbc();
    private final Dispatcher dispatcher = new Dispatcher();
    private final Retry retry = new Retry();
    private final Metrics metrics = new Metrics();

    public StoreType getStore() {
        return store;
    }

    public void setStore(StoreType store) {
        this.store = store;
    }

    public Jdbc getJdbc() {
        return jdbc;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public Retry getRetry() {
        return retry;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public enum StoreType {
        /** JDBC when a DataSource bean exists, in-memory otherwise. */
        AUTO,
        IN_MEMORY,
        JDBC
    }

    public static class Jdbc {
        private String streamTable = TableNames.DEFAULT_STREAM_TABLE;
        private String messageTable = TableNames.DEFAULT_MESSAGE_TABLE;

        public String getStreamTable() {
            return streamTable;
        }

        public void setStreamTable(String streamTable) {
            this.streamTable = streamTable;
        }

        public String getMessageTable() {
            return messageTable;
        }

        public void setMessageTable(String messageTable) {
            this.messageTable = messageTable;
        }
    }

    public static class Dispatcher {
        private boolean enabled = true;
        private long intervalMs = 1000;
        private int batchSize = 100;
        private int maxAttempts = 10;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }
    }

    public static class Retry {
        private long baseDelayMs = 200;
        private long maxDelayMs = 60000;

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "workflow";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
