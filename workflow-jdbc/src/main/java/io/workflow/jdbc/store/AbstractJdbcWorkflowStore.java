package io.workflow.jdbc.store;

import io.workflow.jdbc.JdbcTemplate;
import io.workflow.jdbc.TableNames;
import io.workflow.jdbc.WorkflowStoreException;
import io.workflow.model.MessageDirection;
import io.workflow.model.MessageKind;
import io.workflow.model.WorkflowMessage;
import io.workflow.spi.ConnectionProvider;
import io.workflow.spi.PayloadCodec;
import io.workflow.spi.WorkflowStore;
import io.workflow.util.HeadersCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base JDBC workflow store with standard SQL implementations.
 *
 * <p>Two tables back the store: a stream table with one row per workflow holding the last
 * assigned position, and a message table with one row per log entry keyed by
 * {@code (workflow_id, stream_position)}. An append first makes sure the stream row exists,
 * then bumps {@code last_position} inside a transaction. The row lock taken by that
 * {@code UPDATE} serialises appenders of one workflow while leaving other workflows alone.
 *
 * <p>Instances registered through {@link java.util.ServiceLoader} have no
 * {@link ConnectionProvider}; derive a usable store with
 * {@link #withConnectionProvider(ConnectionProvider)} or use
 * {@link JdbcWorkflowStores#detect(javax.sql.DataSource)}. Subclasses override
 * {@link #insertStreamIfAbsent} and, where the database allows it,
 * {@link #advanceLastPosition}. Register custom implementations via
 * {@code META-INF/services/io.workflow.jdbc.store.AbstractJdbcWorkflowStore}.
 *
 * @see JdbcWorkflowStores
 */
public abstract class AbstractJdbcWorkflowStore implements WorkflowStore {
    private static final Logger logger = Logger.getLogger(AbstractJdbcWorkflowStore.class.getName());

    private static final int MAX_APPEND_ATTEMPTS = 10;
    private static final String MESSAGE_COLUMNS = "workflow_id, stream_position, message_id, kind, "
            + "direction, payload, created_at, processed, headers";
    private static final String OUTPUT_COMMAND = "kind='" + MessageKind.COMMAND.name()
            + "' AND direction='" + MessageDirection.OUTPUT.name() + "'";

    private final ConnectionProvider connectionProvider;
    private final PayloadCodec payloadCodec;
    private final TableNames tableNames;
    private final JdbcTemplate.RowMapper<WorkflowMessage> messageRowMapper = this::mapMessage;

    protected AbstractJdbcWorkflowStore() {
        this(null, PayloadCodec.strings(), TableNames.defaults());
    }

    protected AbstractJdbcWorkflowStore(ConnectionProvider connectionProvider, PayloadCodec payloadCodec,
            TableNames tableNames) {
        this.connectionProvider = connectionProvider;
        this.payloadCodec = Objects.requireNonNull(payloadCodec, "payloadCodec");
        this.tableNames = Objects.requireNonNull(tableNames, "tableNames");
    }

    /**
     * Unique identifier for this store (e.g., "mysql", "postgresql", "h2").
     */
    public abstract String name();

    /**
     * JDBC URL prefixes this store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
     */
    public abstract List<String> jdbcUrlPrefixes();

    /**
     * Creates a store of the same dialect with the given settings.
     */
    protected abstract AbstractJdbcWorkflowStore newInstance(ConnectionProvider connectionProvider,
            PayloadCodec payloadCodec, TableNames tableNames);

    /**
     * Inserts the stream row for {@code workflowId} with {@code last_position = 0} unless one
     * exists. Runs on an auto-commit connection; must not fail when the row is already there.
     */
    protected abstract void insertStreamIfAbsent(Connection conn, String workflowId);

    public AbstractJdbcWorkflowStore withConnectionProvider(ConnectionProvider connectionProvider) {
        return newInstance(Objects.requireNonNull(connectionProvider, "connectionProvider"),
                payloadCodec, tableNames);
    }

    public AbstractJdbcWorkflowStore withPayloadCodec(PayloadCodec payloadCodec) {
        return newInstance(connectionProvider, payloadCodec, tableNames);
    }

    public AbstractJdbcWorkflowStore withTableNames(TableNames tableNames) {
        return newInstance(connectionProvider, payloadCodec, tableNames);
    }

    protected ConnectionProvider connectionProvider() {
        return connectionProvider;
    }

    protected PayloadCodec payloadCodec() {
        return payloadCodec;
    }

    protected TableNames tableNames() {
        return tableNames;
    }

    protected String streamTable() {
        return tableNames.stream();
    }

    protected String messageTable() {
        return tableNames.message();
    }

    @Override
    public long append(String workflowId, List<WorkflowMessage> messages) {
        requireWorkflowId(workflowId);
        Objects.requireNonNull(messages, "messages");
        if (messages.isEmpty()) {
            throw new IllegalArgumentException("messages must not be empty");
        }
        for (WorkflowMessage message : messages) {
            Objects.requireNonNull(message, "message");
            if (!workflowId.equals(message.workflowId())) {
                throw new IllegalArgumentException("Message " + message.messageId()
                        + " belongs to workflowId=" + message.workflowId() + ", not " + workflowId);
            }
        }
        List<String> payloads = new ArrayList<>(messages.size());
        for (WorkflowMessage message : messages) {
            payloads.add(payloadCodec.encode(message.message()));
        }

        try (Connection conn = openConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            try {
                for (int attempt = 1; attempt <= MAX_APPEND_ATTEMPTS; attempt++) {
                    conn.setAutoCommit(true);
                    insertStreamIfAbsent(conn, workflowId);
                    conn.setAutoCommit(false);
                    long last = appendInTransaction(conn, workflowId, messages, payloads);
                    if (last > 0) {
                        if (logger.isLoggable(Level.FINE)) {
                            logger.fine("Appended " + messages.size() + " message(s) to workflowId="
                                    + workflowId + ", last position " + last);
                        }
                        return last;
                    }
                    // stream row deleted between insert and update; recreate it
                }
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new WorkflowStoreException("Failed to append to workflowId=" + workflowId, e);
        }
        throw new WorkflowStoreException("Failed to append to workflowId=" + workflowId
                + ": stream row kept disappearing", null);
    }

    private long appendInTransaction(Connection conn, String workflowId, List<WorkflowMessage> messages,
            List<String> payloads) throws SQLException {
        try {
            long last = advanceLastPosition(conn, workflowId, messages.size());
            if (last < 0) {
                conn.rollback();
                return -1L;
            }
            long base = last - messages.size();
            List<Object[]> rows = new ArrayList<>(messages.size());
            for (int i = 0; i < messages.size(); i++) {
                WorkflowMessage stored = messages.get(i).normalizedAt(base + i + 1);
                rows.add(new Object[] {
                        workflowId, stored.position(), stored.messageId(), stored.kind().name(),
                        stored.direction().name(), payloads.get(i), Timestamp.from(stored.timestamp()),
                        stored.processed(), HeadersCodec.encode(stored.headers())});
            }
            JdbcTemplate.batchUpdate(conn, "INSERT INTO " + messageTable() + " (" + MESSAGE_COLUMNS
                    + ") VALUES (?,?,?,?,?,?,?,?,?)", rows);
            conn.commit();
            return last;
        } catch (RuntimeException | SQLException e) {
            rollbackQuietly(conn, e);
            throw e;
        }
    }

    /**
     * Adds {@code count} to the stream's {@code last_position} and returns the new value,
     * or {@code -1} if the stream row does not exist. Runs inside the append transaction.
     */
    protected long advanceLastPosition(Connection conn, String workflowId, int count) {
        int updated = JdbcTemplate.update(conn,
                "UPDATE " + streamTable() + " SET last_position = last_position + ? WHERE workflow_id=?",
                count, workflowId);
        if (updated == 0) {
            return -1L;
        }
        return selectLastPosition(conn, workflowId);
    }

    protected long selectLastPosition(Connection conn, String workflowId) {
        List<Long> rows = JdbcTemplate.query(conn,
                "SELECT last_position FROM " + streamTable() + " WHERE workflow_id=?",
                rs -> rs.getLong(1), workflowId);
        return rows.isEmpty() ? -1L : rows.get(0);
    }

    @Override
    public List<WorkflowMessage> readStream(String workflowId, long fromPosition) {
        requireWorkflowId(workflowId);
        try (Connection conn = openConnection()) {
            return List.copyOf(JdbcTemplate.query(conn,
                    "SELECT " + MESSAGE_COLUMNS + " FROM " + messageTable()
                            + " WHERE workflow_id=? AND stream_position>=? ORDER BY stream_position",
                    messageRowMapper, workflowId, fromPosition));
        } catch (SQLException e) {
            throw new WorkflowStoreException("Failed to read workflowId=" + workflowId, e);
        }
    }

    @Override
    public List<WorkflowMessage> pendingCommands(String workflowId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0, got: " + limit);
        }
        String sql = "SELECT " + MESSAGE_COLUMNS + " FROM " + messageTable()
                + " WHERE " + OUTPUT_COMMAND + " AND processed=?"
                + (workflowId != null ? " AND workflow_id=?" : "")
                + " ORDER BY workflow_id, stream_position LIMIT ?";
        try (Connection conn = openConnection()) {
            List<WorkflowMessage> result = workflowId != null
                    ? JdbcTemplate.query(conn, sql, messageRowMapper, Boolean.FALSE, workflowId, limit)
                    : JdbcTemplate.query(conn, sql, messageRowMapper, Boolean.FALSE, limit);
            return List.copyOf(result);
        } catch (SQLException e) {
            throw new WorkflowStoreException("Failed to query pending commands", e);
        }
    }

    @Override
    public void markCommandProcessed(String workflowId, long position) {
        requireWorkflowId(workflowId);
        try (Connection conn = openConnection()) {
            int updated = JdbcTemplate.update(conn,
                    "UPDATE " + messageTable() + " SET processed=?"
                            + " WHERE workflow_id=? AND stream_position=? AND " + OUTPUT_COMMAND
                            + " AND processed=?",
                    Boolean.TRUE, workflowId, position, Boolean.FALSE);
            if (updated == 0) {
                throw diagnoseMarkFailure(conn, workflowId, position);
            }
        } catch (SQLException e) {
            throw new WorkflowStoreException("Failed to mark position " + position
                    + " of workflowId=" + workflowId, e);
        }
    }

    private IllegalStateException diagnoseMarkFailure(Connection conn, String workflowId, long position) {
        if (selectLastPosition(conn, workflowId) <= 0) {
            return new IllegalStateException("Workflow " + workflowId + " not found");
        }
        List<WorkflowMessage> rows = JdbcTemplate.query(conn,
                "SELECT " + MESSAGE_COLUMNS + " FROM " + messageTable()
                        + " WHERE workflow_id=? AND stream_position=?",
                messageRowMapper, workflowId, position);
        if (rows.isEmpty()) {
            return new IllegalStateException(
                    "Message at position " + position + " not found in workflow " + workflowId);
        }
        if (!rows.get(0).isOutputCommand()) {
            return new IllegalStateException("Message at position " + position + " in workflow "
                    + workflowId + " is not an output command");
        }
        return new IllegalStateException("Command at position " + position + " in workflow "
                + workflowId + " is already processed");
    }

    @Override
    public boolean exists(String workflowId) {
        requireWorkflowId(workflowId);
        try (Connection conn = openConnection()) {
            return selectLastPosition(conn, workflowId) > 0;
        } catch (SQLException e) {
            throw new WorkflowStoreException("Failed to look up workflowId=" + workflowId, e);
        }
    }

    @Override
    public void delete(String workflowId) {
        requireWorkflowId(workflowId);
        try (Connection conn = openConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                // stream row first: waits for any in-flight append of this workflow
                int streams = JdbcTemplate.update(conn,
                        "DELETE FROM " + streamTable() + " WHERE workflow_id=?", workflowId);
                int messages = JdbcTemplate.update(conn,
                        "DELETE FROM " + messageTable() + " WHERE workflow_id=?", workflowId);
                conn.commit();
                if (streams > 0 && logger.isLoggable(Level.FINE)) {
                    logger.fine("Deleted workflowId=" + workflowId + " with " + messages + " message(s)");
                }
            } catch (RuntimeException | SQLException e) {
                rollbackQuietly(conn, e);
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new WorkflowStoreException("Failed to delete workflowId=" + workflowId, e);
        }
    }

    private WorkflowMessage mapMessage(ResultSet rs) throws SQLException {
        boolean processed = rs.getBoolean("processed");
        Boolean processedFlag = rs.wasNull() ? null : processed;
        return new WorkflowMessage(
                rs.getString("message_id"),
                rs.getString("workflow_id"),
                rs.getLong("stream_position"),
                MessageKind.valueOf(rs.getString("kind")),
                MessageDirection.valueOf(rs.getString("direction")),
                payloadCodec.decode(rs.getString("payload")),
                rs.getTimestamp("created_at").toInstant(),
                processedFlag,
                HeadersCodec.decode(rs.getString("headers")));
    }

    private Connection openConnection() throws SQLException {
        if (connectionProvider == null) {
            throw new IllegalStateException("Store '" + name()
                    + "' has no ConnectionProvider; use withConnectionProvider(...)");
        }
        return connectionProvider.getConnection();
    }

    private static void rollbackQuietly(Connection conn, Exception original) {
        try {
            conn.rollback();
        } catch (SQLException rollbackError) {
            original.addSuppressed(rollbackError);
        }
    }

    private static void requireWorkflowId(String workflowId) {
        if (workflowId == null || workflowId.isBlank()) {
            throw new IllegalArgumentException("workflowId must not be blank");
        }
    }
}
