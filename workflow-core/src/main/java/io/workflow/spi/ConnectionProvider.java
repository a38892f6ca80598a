package io.workflow.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Source of JDBC connections for the JDBC-backed workflow stores.
 *
 * <p>Callers close the returned connection.
 *
 * @see io.workflow.jdbc.DataSourceConnectionProvider
 */
public interface ConnectionProvider {

    Connection getConnection() throws SQLException;
}
