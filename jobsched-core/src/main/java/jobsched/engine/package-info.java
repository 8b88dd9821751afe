/**
 * The scheduling loop: working-set reloads, due detection and marker-based claims.
 *
 * @see jobsched.engine.JobScheduler
 */
package jobsched.engine;
