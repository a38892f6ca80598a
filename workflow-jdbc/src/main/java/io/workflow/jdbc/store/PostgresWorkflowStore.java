package io.workflow.jdbc.store;

import io.workflow.jdbc.JdbcTemplate;
import io.workflow.jdbc.TableNames;
import io.workflow.spi.ConnectionProvider;
import io.workflow.spi.PayloadCodec;

import java.sql.Connection;
import java.util.List;

/**
 * PostgreSQL workflow store.
 *
 * <p>Creates stream rows with {@code ON CONFLICT DO NOTHING} and advances the position with
 * {@code UPDATE ... RETURNING} in a single round-trip.
 */
public final class PostgresWorkflowStore extends AbstractJdbcWorkflowStore {

    public PostgresWorkflowStore() {
        super();
    }

    public PostgresWorkflowStore(ConnectionProvider connectionProvider, PayloadCodec payloadCodec,
            TableNames tableNames) {
        super(connectionProvider, payloadCodec, tableNames);
    }

    @Override
    protected AbstractJdbcWorkflowStore newInstance(ConnectionProvider connectionProvider,
            PayloadCodec payloadCodec, TableNames tableNames) {
        return new PostgresWorkflowStore(connectionProvider, payloadCodec, tableNames);
    }

    @Override
    public String name() {
        return "postgresql";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:postgresql:");
    }

    @Override
    protected void insertStreamIfAbsent(Connection conn, String workflowId) {
        JdbcTemplate.update(conn, "INSERT INTO " + streamTable() + " (workflow_id, last_position)"
                + " VALUES (?, 0) ON CONFLICT (workflow_id) DO NOTHING", workflowId);
    }

    @Override
    protected long advanceLastPosition(Connection conn, String workflowId, int count) {
        List<Long> rows = JdbcTemplate.updateReturning(conn,
                "UPDATE " + streamTable() + " SET last_position = last_position + ?"
                        + " WHERE workflow_id=? RETURNING last_position",
                rs -> rs.getLong(1), count, workflowId);
        return rows.isEmpty() ? -1L : rows.get(0);
    }
}
