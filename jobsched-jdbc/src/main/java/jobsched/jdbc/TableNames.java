package jobsched.jdbc;

import java.util.Objects;

/**
 * Validates the name of the job table. The name is spliced into every store statement, so
 * only unquoted identifiers that all supported databases accept are allowed.
 */
public final class TableNames {
  public static final String DEFAULT_TABLE = "scheduled_job";

  /** PostgreSQL truncates identifiers beyond 63 bytes; MySQL allows 64. */
  static final int MAX_LENGTH = 63;

  private static final String IDENTIFIER = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (tableName.length() > MAX_LENGTH || !tableName.matches(IDENTIFIER)) {
      throw new IllegalArgumentException("Job table name '" + tableName
          + "' must be an unquoted SQL identifier of at most " + MAX_LENGTH + " characters");
    }
    return tableName;
  }
}
