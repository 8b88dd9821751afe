/**
 * JDBC-based {@link jobsched.spi.JobStore} implementations.
 *
 * <p>{@link jobsched.jdbc.store.AbstractJdbcJobStore} provides shared SQL and row mapping;
 * subclasses cover H2, MySQL/TiDB and PostgreSQL. Table DDL ships under
 * {@code jobsched/schema/} on the classpath.
 *
 * @see jobsched.jdbc.JdbcJobStores
 */
package jobsched.jdbc;
