package jobsched.jdbc.store;

import jobsched.DuplicateJobNameException;
import jobsched.Job;
import jobsched.jdbc.ConnectionProvider;
import jobsched.jdbc.JdbcTemplate;
import jobsched.jdbc.JobStoreException;
import jobsched.jdbc.TableNames;
import jobsched.model.ClaimRequest;
import jobsched.model.ClaimResult;
import jobsched.model.JobQuery;
import jobsched.spi.JobStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC job store with standard SQL implementations.
 *
 * <p>Every operation borrows a connection from the {@link ConnectionProvider} and runs in
 * auto-commit mode. {@link #claim} is a single conditional {@code UPDATE} keyed on the job id
 * and its expected marker, so concurrent schedulers never both succeed. Subclasses may
 * override it to return the updated row in the same round trip.
 *
 * <p>Instants are stored with millisecond precision.
 *
 * @see JdbcJobStores
 */
public abstract class AbstractJdbcJobStore implements JobStore {
  protected static final String COLUMNS =
      "id, name, channel, active, cron_expression, next_run_at, last_run_marker, " +
      "start_date, end_date, params, created_at";

  protected static final JdbcTemplate.RowMapper<Job> JOB_ROW_MAPPER = rs -> Job.builder(rs.getString("name"))
      .id(rs.getLong("id"))
      .channel(rs.getString("channel"))
      .active(rs.getBoolean("active"))
      .cronExpression(rs.getString("cron_expression"))
      .nextRunAt(toInstant(rs.getTimestamp("next_run_at")))
      .lastRunMarker(rs.getLong("last_run_marker"))
      .startDate(toInstant(rs.getTimestamp("start_date")))
      .endDate(toInstant(rs.getTimestamp("end_date")))
      .params(rs.getString("params"))
      .createdAt(toInstant(rs.getTimestamp("created_at")))
      .build();

  private final ConnectionProvider connectionProvider;
  private final String tableName;

  protected AbstractJdbcJobStore(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.DEFAULT_TABLE);
  }

  protected AbstractJdbcJobStore(ConnectionProvider connectionProvider, String tableName) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.tableName = TableNames.validate(tableName);
  }

  /**
   * Unique identifier for this job store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this job store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  protected String tableName() {
    return tableName;
  }

  @Override
  public Job create(Job job) {
    Job stored = job.toBuilder()
        .nextRunAt(millis(job.nextRunAt()))
        .startDate(millis(job.startDate()))
        .endDate(millis(job.endDate()))
        .createdAt(millis(job.createdAt() != null ? job.createdAt() : Instant.now()))
        .build();
    String sql = "INSERT INTO " + tableName() + " (" +
        "name, channel, active, cron_expression, next_run_at, last_run_marker, " +
        "start_date, end_date, params, created_at" +
        ") VALUES (?,?,?,?,?,?,?,?,?,?)";
    try (Connection conn = connection()) {
      long id = JdbcTemplate.insertReturningKey(conn, sql, "id",
          stored.name(), stored.channel(), stored.active(), stored.cronExpression(),
          timestamp(stored.nextRunAt()), stored.lastRunMarker(),
          timestamp(stored.startDate()), timestamp(stored.endDate()),
          stored.params(), timestamp(stored.createdAt()));
      return stored.toBuilder().id(id).build();
    } catch (JobStoreException e) {
      if (e.isUniqueViolation()) {
        throw new DuplicateJobNameException(job.name(), e);
      }
      throw e;
    } catch (SQLException e) {
      throw new JobStoreException("Failed to close connection", e);
    }
  }

  @Override
  public List<Job> loadDue(Instant now, Duration horizon) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE active=? AND next_run_at IS NOT NULL AND next_run_at <= ?" +
        " AND start_date <= ? AND (end_date IS NULL OR end_date >= ?)" +
        " ORDER BY next_run_at";
    Timestamp nowTs = Timestamp.from(now);
    try (Connection conn = connection()) {
      return JdbcTemplate.query(conn, sql, JOB_ROW_MAPPER,
          Boolean.TRUE, Timestamp.from(now.plus(horizon)), nowTs, nowTs);
    } catch (SQLException e) {
      throw new JobStoreException("Failed to close connection", e);
    }
  }

  @Override
  public ClaimResult claim(ClaimRequest request) {
    String sql = "UPDATE " + tableName() +
        " SET next_run_at=?, active=?, last_run_marker=?" +
        " WHERE id=? AND last_run_marker=?";
    Job claimed = request.claimedJob();
    try (Connection conn = connection()) {
      int updated = JdbcTemplate.update(conn, sql,
          timestamp(millis(request.nextRunAt())), request.active(), request.newMarker(),
          request.jobId(), request.expectedMarker());
      return updated == 1 ? ClaimResult.won(claimed) : ClaimResult.lost();
    } catch (SQLException e) {
      throw new JobStoreException("Failed to close connection", e);
    }
  }

  @Override
  public Optional<Job> findByName(String name) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE name=?";
    try (Connection conn = connection()) {
      return JdbcTemplate.query(conn, sql, JOB_ROW_MAPPER, name).stream().findFirst();
    } catch (SQLException e) {
      throw new JobStoreException("Failed to close connection", e);
    }
  }

  @Override
  public boolean removeByName(String name) {
    String sql = "DELETE FROM " + tableName() + " WHERE name=?";
    try (Connection conn = connection()) {
      return JdbcTemplate.update(conn, sql, name) > 0;
    } catch (SQLException e) {
      throw new JobStoreException("Failed to close connection", e);
    }
  }

  @Override
  public int purge(JobQuery query) {
    StringBuilder sql = new StringBuilder("DELETE FROM ").append(tableName());
    List<Object> params = new ArrayList<>();
    String separator = " WHERE ";
    if (query.name() != null) {
      sql.append(separator).append("name=?");
      params.add(query.name());
      separator = " AND ";
    }
    if (query.channel() != null) {
      sql.append(separator).append("channel=?");
      params.add(query.channel());
      separator = " AND ";
    }
    if (query.active() != null) {
      sql.append(separator).append("active=?");
      params.add(query.active());
    }
    try (Connection conn = connection()) {
      return JdbcTemplate.update(conn, sql.toString(), params.toArray());
    } catch (SQLException e) {
      throw new JobStoreException("Failed to close connection", e);
    }
  }

  protected Connection connection() {
    try {
      return connectionProvider.getConnection();
    } catch (SQLException e) {
      throw new JobStoreException("Failed to obtain connection", e);
    }
  }

  protected static Timestamp timestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  protected static Instant millis(Instant instant) {
    return instant == null ? null : instant.truncatedTo(ChronoUnit.MILLIS);
  }

  private static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
