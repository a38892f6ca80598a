/**
 * JDBC infrastructure shared by the workflow stores.
 *
 * <p>{@link io.workflow.jdbc.JdbcTemplate} provides lightweight JDBC helpers.
 * {@link io.workflow.jdbc.DataSourceConnectionProvider} adapts a {@link javax.sql.DataSource}
 * to the {@link io.workflow.spi.ConnectionProvider} SPI.
 */
package io.workflow.jdbc;
