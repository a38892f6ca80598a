package io.workflow.jdbc;

import java.util.Objects;

/**
 * Names of the two tables a JDBC workflow store reads and writes.
 *
 * <p>Names are interpolated into SQL, so only plain identifiers are accepted.
 *
 * @param stream  one row per workflow holding its last assigned position
 * @param message one row per log entry
 */
public record TableNames(String stream, String message) {
    public static final String DEFAULT_STREAM_TABLE = "workflow_stream";
    public static final String DEFAULT_MESSAGE_TABLE = "workflow_message";
    private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

    public TableNames {
        validate(stream);
        validate(message);
        if (stream.equalsIgnoreCase(message)) {
            throw new IllegalArgumentException("Stream and message tables must differ: " + stream);
        }
    }

    public static TableNames defaults() {
        return new TableNames(DEFAULT_STREAM_TABLE, DEFAULT_MESSAGE_TABLE);
    }

    public static String validate(String tableName) {
        Objects.requireNonNull(tableName, "tableName");
        if (!tableName.matches(TABLE_NAME_PATTERN)) {
            throw new IllegalArgumentException("Invalid table name: " + tableName);
        }
        return tableName;
    }
}
