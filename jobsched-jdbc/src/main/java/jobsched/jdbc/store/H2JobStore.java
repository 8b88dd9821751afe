package jobsched.jdbc.store;

import jobsched.jdbc.ConnectionProvider;

import java.util.List;

/**
 * H2 job store. Primarily for testing.
 *
 * <p>Uses the conditional-update claim from {@link AbstractJdbcJobStore}.
 */
public final class H2JobStore extends AbstractJdbcJobStore {

  public H2JobStore(ConnectionProvider connectionProvider) {
    super(connectionProvider);
  }

  public H2JobStore(ConnectionProvider connectionProvider, String tableName) {
    super(connectionProvider, tableName);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
