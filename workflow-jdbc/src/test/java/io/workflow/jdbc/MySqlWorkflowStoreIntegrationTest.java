package io.workflow.jdbc;

import io.workflow.jdbc.store.AbstractJdbcWorkflowStore;
import io.workflow.jdbc.store.JdbcWorkflowStores;
import io.workflow.jdbc.store.MySqlWorkflowStore;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;

@DockerAvailable
@Testcontainers
class MySqlWorkflowStoreIntegrationTest extends AbstractWorkflowStoreIntegrationTest {

    @Container
    static final MySQLContainer<?> mysql = new MySQLContainer<>("mysql:8.0")
            .withDatabaseName("workflow_test");

    private static SimpleDataSource dataSource;
    private static AbstractJdbcWorkflowStore store;

    @BeforeAll
    static void initSchema() throws Exception {
        dataSource = new SimpleDataSource(mysql.getJdbcUrl(), mysql.getUsername(), mysql.getPassword());
        Schemas.create(dataSource, "/schema/mysql.sql");
        store = JdbcWorkflowStores.detect(dataSource);
        assertInstanceOf(MySqlWorkflowStore.class, store);
    }

    @BeforeEach
    void clear() throws Exception {
        Schemas.clear(dataSource);
    }

    @Override
    AbstractJdbcWorkflowStore store() {
        return store;
    }
}
