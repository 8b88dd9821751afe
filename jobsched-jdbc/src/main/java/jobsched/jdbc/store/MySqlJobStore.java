package jobsched.jdbc.store;

import jobsched.jdbc.ConnectionProvider;

import java.util.List;

/**
 * MySQL job store. Also compatible with TiDB.
 *
 * <p>The conditional {@code UPDATE} claim is atomic under InnoDB row locking; the
 * update count tells the winner apart.
 */
public final class MySqlJobStore extends AbstractJdbcJobStore {

  public MySqlJobStore(ConnectionProvider connectionProvider) {
    super(connectionProvider);
  }

  public MySqlJobStore(ConnectionProvider connectionProvider, String tableName) {
    super(connectionProvider, tableName);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }
}
