package io.bulkaction.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Source of JDBC connections for the engine's own units of work (batch processing,
 * scheduling, undo, purge). The caller closes the returned connection.
 */
@FunctionalInterface
public interface ConnectionProvider {

  Connection getConnection() throws SQLException;
}
