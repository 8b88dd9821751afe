package jobsched.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for job store operations.
 *
 * <p>Each store call obtains a connection, runs in auto-commit mode and closes it.
 *
 * @see DataSourceConnectionProvider
 */
@FunctionalInterface
public interface ConnectionProvider {

  /**
   * Obtains a new JDBC connection.
   *
   * @return an open connection; the caller must close it
   * @throws SQLException if a connection cannot be obtained
   */
  Connection getConnection() throws SQLException;
}
