package io.workflow.jdbc.store;

import io.workflow.jdbc.JdbcTemplate;
import io.workflow.jdbc.TableNames;
import io.workflow.spi.ConnectionProvider;
import io.workflow.spi.PayloadCodec;

import java.sql.Connection;
import java.util.List;

/**
 * MySQL workflow store. Also compatible with TiDB.
 *
 * <p>Creates stream rows with {@code INSERT IGNORE}. The position is advanced with a plain
 * {@code UPDATE} followed by a {@code SELECT} in the same transaction; the row lock held
 * since the update keeps the two consistent.
 */
public final class MySqlWorkflowStore extends AbstractJdbcWorkflowStore {

    public MySqlWorkflowStore() {
        super();
    }

    public MySqlWorkflowStore(ConnectionProvider connectionProvider, PayloadCodec payloadCodec,
            TableNames tableNames) {
        super(connectionProvider, payloadCodec, tableNames);
    }

    @Override
    protected AbstractJdbcWorkflowStore newInstance(ConnectionProvider connectionProvider,
            PayloadCodec payloadCodec, TableNames tableNames) {
        return new MySqlWorkflowStore(connectionProvider, payloadCodec, tableNames);
    }

    @Override
    public String name() {
        return "mysql";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:mysql:", "jdbc:tidb:");
    }

    @Override
    protected void insertStreamIfAbsent(Connection conn, String workflowId) {
        JdbcTemplate.update(conn, "INSERT IGNORE INTO " + streamTable() + " (workflow_id, last_position)"
                + " VALUES (?, 0)", workflowId);
    }
}
