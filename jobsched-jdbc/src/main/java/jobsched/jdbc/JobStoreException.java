package jobsched.jdbc;

import jobsched.JobSchedulerException;

import java.sql.SQLException;

/**
 * Unchecked exception wrapping JDBC errors thrown by
 * {@link jobsched.jdbc.store.AbstractJdbcJobStore} and its subclasses.
 */
public final class JobStoreException extends JobSchedulerException {
  private static final String UNIQUE_VIOLATION = "23505";
  private static final int MYSQL_DUP_ENTRY = 1062;

  public JobStoreException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Returns {@code true} if the underlying SQL error is a unique key conflict
   * (SQLState {@code 23505}, or MySQL error 1062).
   *
   * @return whether a unique constraint was violated
   */
  public boolean isUniqueViolation() {
    Throwable cause = getCause();
    while (cause != null) {
      if (cause instanceof SQLException sql
          && (UNIQUE_VIOLATION.equals(sql.getSQLState()) || sql.getErrorCode() == MYSQL_DUP_ENTRY)) {
        return true;
      }
      cause = cause.getCause();
    }
    return false;
  }
}
