package jobsched.jdbc;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Borrows job store connections from a pooled {@link DataSource}. Each store call takes one
 * connection in auto-commit mode and returns it when the statement completes.
 */
public final class DataSourceConnectionProvider implements ConnectionProvider {
  private final DataSource dataSource;

  public DataSourceConnectionProvider(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  public DataSource dataSource() {
    return dataSource;
  }

  /**
   * Reads the JDBC URL of the underlying database, used to pick the matching job store.
   *
   * @return the URL reported by the driver
   * @throws SQLException if no connection can be obtained
   */
  public String jdbcUrl() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      return conn.getMetaData().getURL();
    }
  }

  @Override
  public Connection getConnection() throws SQLException {
    return dataSource.getConnection();
  }
}
