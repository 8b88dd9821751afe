package jobsched.jdbc.store;

import jobsched.jdbc.ConnectionProvider;
import jobsched.jdbc.JdbcTemplate;
import jobsched.jdbc.JobStoreException;
import jobsched.model.ClaimRequest;
import jobsched.model.ClaimResult;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * PostgreSQL job store.
 *
 * <p>Claims with {@code UPDATE ... RETURNING} so the winner reads the stored row in the
 * same round trip.
 */
public final class PostgresJobStore extends AbstractJdbcJobStore {

  public PostgresJobStore(ConnectionProvider connectionProvider) {
    super(connectionProvider);
  }

  public PostgresJobStore(ConnectionProvider connectionProvider, String tableName) {
    super(connectionProvider, tableName);
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
  public ClaimResult claim(ClaimRequest request) {
    String sql = "UPDATE " + tableName() +
        " SET next_run_at=?, active=?, last_run_marker=?" +
        " WHERE id=? AND last_run_marker=?" +
        " RETURNING " + COLUMNS;
    try (Connection conn = connection()) {
      return JdbcTemplate.updateReturning(conn, sql, JOB_ROW_MAPPER,
              timestamp(millis(request.nextRunAt())), request.active(), request.newMarker(),
              request.jobId(), request.expectedMarker())
          .stream()
          .findFirst()
          .map(job -> ClaimResult.won(job))
          .orElseGet(ClaimResult::lost);
    } catch (SQLException e) {
      throw new JobStoreException("Failed to close connection", e);
    }
  }
}
