package io.workflow.jdbc.store;

import io.workflow.jdbc.JdbcTemplate;
import io.workflow.jdbc.TableNames;
import io.workflow.jdbc.WorkflowStoreException;
import io.workflow.spi.ConnectionProvider;
import io.workflow.spi.PayloadCodec;

import java.sql.Connection;
import java.util.List;
import java.util.logging.Logger;

/**
 * H2 workflow store. Primarily for testing.
 *
 * <p>Creates stream rows with a lookup followed by a plain {@code INSERT}; a concurrent creator
 * that wins the race surfaces as a unique-key violation, which means the row is there.
 */
public final class H2WorkflowStore extends AbstractJdbcWorkflowStore {
    private static final Logger logger = Logger.getLogger(H2WorkflowStore.class.getName());

    public H2WorkflowStore() {
        super();
    }

    public H2WorkflowStore(ConnectionProvider connectionProvider, PayloadCodec payloadCodec,
            TableNames tableNames) {
        super(connectionProvider, payloadCodec, tableNames);
    }

    @Override
    protected AbstractJdbcWorkflowStore newInstance(ConnectionProvider connectionProvider,
            PayloadCodec payloadCodec, TableNames tableNames) {
        return new H2WorkflowStore(connectionProvider, payloadCodec, tableNames);
    }

    @Override
    public String name() {
        return "h2";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:h2:");
    }

    @Override
    protected void insertStreamIfAbsent(Connection conn, String workflowId) {
        if (selectLastPosition(conn, workflowId) >= 0) {
            return;
        }
        try {
            JdbcTemplate.update(conn, "INSERT INTO " + streamTable() + " (workflow_id, last_position)"
                    + " VALUES (?, 0)", workflowId);
        } catch (WorkflowStoreException e) {
            if (!JdbcTemplate.isConstraintViolation(e)) {
                throw e;
            }
            logger.fine("Stream row for workflowId=" + workflowId + " created concurrently");
        }
    }
}
