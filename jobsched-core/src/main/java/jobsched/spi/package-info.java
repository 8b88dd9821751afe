/**
 * Service provider interfaces consumed by the scheduling engine.
 *
 * <ul>
 *   <li>{@link jobsched.spi.JobStore}: persistence with an atomic conditional claim</li>
 *   <li>{@link jobsched.spi.CronEvaluator}: next occurrence of a cron expression</li>
 *   <li>{@link jobsched.spi.MetricsExporter}: counters and gauges</li>
 * </ul>
 */
package jobsched.spi;
