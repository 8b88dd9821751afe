/**
 * Spring Boot auto-configuration for the job scheduler.
 *
 * <p>Properties live under {@code jobsched.*}; see
 * {@link jobsched.spring.boot.JobSchedulerProperties}.
 */
package jobsched.spring.boot;
