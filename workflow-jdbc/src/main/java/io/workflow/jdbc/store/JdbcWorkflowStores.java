package io.workflow.jdbc.store;

import io.workflow.jdbc.DataSourceConnectionProvider;
import io.workflow.spi.PayloadCodec;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC workflow stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.workflow.jdbc.store.AbstractJdbcWorkflowStore}. Registered
 * instances carry no connection provider; the {@link DataSource} variants of
 * {@code detect} return a store bound to that data source.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect and bind to a DataSource
 * AbstractJdbcWorkflowStore store = JdbcWorkflowStores.detect(dataSource, payloadCodec);
 *
 * // Auto-detect from JDBC URL, bind later
 * AbstractJdbcWorkflowStore dialect = JdbcWorkflowStores.detect("jdbc:mysql://localhost/mydb");
 *
 * // Get by name
 * AbstractJdbcWorkflowStore store = JdbcWorkflowStores.get("postgresql");
 * }</pre>
 */
public final class JdbcWorkflowStores {

    private static final List<AbstractJdbcWorkflowStore> STORES;
    private static final Map<String, AbstractJdbcWorkflowStore> BY_NAME = new ConcurrentHashMap<>();

    static {
        STORES = ServiceLoader.load(AbstractJdbcWorkflowStore.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        for (AbstractJdbcWorkflowStore store : STORES) {
            BY_NAME.put(store.name().toLowerCase(), store);
        }
    }

    private JdbcWorkflowStores() {
    }

    /**
     * Returns all registered stores.
     */
    public static List<AbstractJdbcWorkflowStore> all() {
        return STORES;
    }

    /**
     * Gets a store by name.
     *
     * @param name store name (case-insensitive)
     * @throws IllegalArgumentException if no store is registered under that name
     */
    public static AbstractJdbcWorkflowStore get(String name) {
        Objects.requireNonNull(name, "name");
        AbstractJdbcWorkflowStore store = BY_NAME.get(name.toLowerCase());
        if (store == null) {
            throw new IllegalArgumentException("Unknown workflow store: " + name +
                    ". Available: " + BY_NAME.keySet());
        }
        return store;
    }

    /**
     * Detects the store for a DataSource and binds it to that DataSource, with string payloads.
     *
     * @throws IllegalStateException if the connection metadata cannot be read
     * @throws IllegalArgumentException if no registered store matches the JDBC URL
     */
    public static AbstractJdbcWorkflowStore detect(DataSource dataSource) {
        return detect(dataSource, PayloadCodec.strings());
    }

    /**
     * Detects the store for a DataSource and binds it to that DataSource and payload codec.
     */
    public static AbstractJdbcWorkflowStore detect(DataSource dataSource, PayloadCodec payloadCodec) {
        Objects.requireNonNull(dataSource, "dataSource");
        Objects.requireNonNull(payloadCodec, "payloadCodec");
        String url;
        try (Connection conn = dataSource.getConnection()) {
            url = conn.getMetaData().getURL();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to detect workflow store from DataSource", e);
        }
        return detect(url)
                .withPayloadCodec(payloadCodec)
                .withConnectionProvider(new DataSourceConnectionProvider(dataSource));
    }

    /**
     * Detects the store from a JDBC URL. The result has no connection provider.
     *
     * @throws IllegalArgumentException if no registered store matches
     */
    public static AbstractJdbcWorkflowStore detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }

        for (AbstractJdbcWorkflowStore store : STORES) {
            for (String prefix : store.jdbcUrlPrefixes()) {
                if (jdbcUrl.toLowerCase().startsWith(prefix.toLowerCase())) {
                    return store;
                }
            }
        }

        throw new IllegalArgumentException("No workflow store found for JDBC URL: " + jdbcUrl +
                ". Supported prefixes: " + allPrefixes());
    }

    private static List<String> allPrefixes() {
        return STORES.stream()
                .flatMap(s -> s.jdbcUrlPrefixes().stream())
                .toList();
    }
}
