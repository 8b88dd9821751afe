package jobsched.jdbc;

import jobsched.jdbc.store.AbstractJdbcJobStore;
import jobsched.jdbc.store.H2JobStore;
import jobsched.jdbc.store.MySqlJobStore;
import jobsched.jdbc.store.PostgresJobStore;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.BiFunction;

/**
 * Factory for JDBC job stores with auto-detection support.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcJobStore store = JdbcJobStores.detect(dataSource);
 *
 * // Custom table name
 * AbstractJdbcJobStore store = JdbcJobStores.detect(dataSource, "billing_job");
 *
 * // By name
 * AbstractJdbcJobStore store = JdbcJobStores.create("postgresql", provider, "scheduled_job");
 * }</pre>
 */
public final class JdbcJobStores {

  private record Variant(String name,
      BiFunction<ConnectionProvider, String, AbstractJdbcJobStore> factory) {}

  private static final List<Variant> VARIANTS = List.of(
      new Variant("h2", H2JobStore::new),
      new Variant("mysql", MySqlJobStore::new),
      new Variant("postgresql", PostgresJobStore::new));

  private JdbcJobStores() {
  }

  /**
   * Returns the names of the supported databases.
   */
  public static List<String> names() {
    return VARIANTS.stream().map(Variant::name).toList();
  }

  /**
   * Creates a job store by database name.
   *
   * @param name               store name (case-insensitive)
   * @param connectionProvider the connection source
   * @param tableName          the job table
   * @return the job store
   * @throws IllegalArgumentException if no store has that name
   */
  public static AbstractJdbcJobStore create(String name, ConnectionProvider connectionProvider, String tableName) {
    String key = name.toLowerCase(Locale.ROOT);
    for (Variant variant : VARIANTS) {
      if (variant.name().equals(key)) {
        return variant.factory().apply(connectionProvider, tableName);
      }
    }
    throw new IllegalArgumentException("Unknown job store: " + name + ". Available: " + names());
  }

  public static AbstractJdbcJobStore detect(DataSource dataSource) {
    return detect(dataSource, TableNames.DEFAULT_TABLE);
  }

  /**
   * Auto-detects the job store from a DataSource's JDBC URL.
   *
   * @param dataSource the data source
   * @param tableName  the job table
   * @return detected job store
   * @throws IllegalStateException if detection fails or no store matches
   */
  public static AbstractJdbcJobStore detect(DataSource dataSource, String tableName) {
    DataSourceConnectionProvider provider = new DataSourceConnectionProvider(dataSource);
    String url;
    try {
      url = provider.jdbcUrl();
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect job store from DataSource", e);
    }
    try {
      return detect(url, provider, tableName);
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException(e.getMessage(), e);
    }
  }

  /**
   * Auto-detects the job store from a JDBC URL.
   *
   * @param jdbcUrl            the JDBC URL
   * @param connectionProvider the connection source
   * @param tableName          the job table
   * @return detected job store
   * @throws IllegalArgumentException if no store matches
   */
  public static AbstractJdbcJobStore detect(String jdbcUrl, ConnectionProvider connectionProvider, String tableName) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String lower = jdbcUrl.toLowerCase(Locale.ROOT);
    List<String> supported = new ArrayList<>();
    for (Variant variant : VARIANTS) {
      AbstractJdbcJobStore candidate = variant.factory().apply(connectionProvider, tableName);
      for (String prefix : candidate.jdbcUrlPrefixes()) {
        if (lower.startsWith(prefix)) {
          return candidate;
        }
        supported.add(prefix);
      }
    }
    throw new IllegalArgumentException("No job store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + supported);
  }
}
