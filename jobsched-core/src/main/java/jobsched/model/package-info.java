/**
 * Value types exchanged with the {@linkplain jobsched.spi.JobStore job store}: the
 * claim request/result pair and purge criteria.
 */
package jobsched.model;
