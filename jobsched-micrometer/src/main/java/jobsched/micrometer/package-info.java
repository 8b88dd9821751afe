/**
 * Micrometer bridge for scheduler metrics.
 *
 * @see jobsched.micrometer.MicrometerMetricsExporter
 */
package jobsched.micrometer;
