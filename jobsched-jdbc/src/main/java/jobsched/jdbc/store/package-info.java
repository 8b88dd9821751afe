/**
 * Database-specific {@link jobsched.spi.JobStore} implementations.
 *
 * <ul>
 *   <li>{@link jobsched.jdbc.store.H2JobStore}</li>
 *   <li>{@link jobsched.jdbc.store.MySqlJobStore} (also TiDB)</li>
 *   <li>{@link jobsched.jdbc.store.PostgresJobStore}</li>
 * </ul>
 */
package jobsched.jdbc.store;
