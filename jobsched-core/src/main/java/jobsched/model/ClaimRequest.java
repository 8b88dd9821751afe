package jobsched.model;

import jobsched.Job;

import java.time.Instant;
import java.util.Objects;

/**
 * Compare-and-swap request sent to {@link jobsched.spi.JobStore#claim}.
 *
 * <p>The store applies {@code nextRunAt}, {@code active} and {@code newMarker} to the job's
 * row only if the row's marker still equals {@code expectedMarker}, the value this process
 * last observed.
 *
 * @param job            the job as last observed in the working set
 * @param expectedMarker marker value the row must still hold
 * @param newMarker      marker value written on success
 * @param nextRunAt      next due instant, or {@code null} when the job retires
 * @param active         whether the job remains eligible to fire
 */
public record ClaimRequest(
    Job job,
    long expectedMarker,
    long newMarker,
    Instant nextRunAt,
    boolean active
) {

  public ClaimRequest {
    Objects.requireNonNull(job, "job");
    Objects.requireNonNull(job.id(), "job.id");
    if (newMarker == expectedMarker) {
      throw new IllegalArgumentException("newMarker must differ from expectedMarker");
    }
    if (active && nextRunAt == null) {
      throw new IllegalArgumentException("active job requires nextRunAt");
    }
  }

  /**
   * Creates a request that advances a job to {@code nextRunAt}, or retires it when
   * {@code nextRunAt} is {@code null}.
   *
   * @param job       the observed job
   * @param newMarker the marker written on success
   * @param nextRunAt the next due instant, or {@code null}
   * @return a new request expecting the job's current marker
   */
  public static ClaimRequest of(Job job, long newMarker, Instant nextRunAt) {
    return new ClaimRequest(job, job.lastRunMarker(), newMarker, nextRunAt, nextRunAt != null);
  }

  public Long jobId() {
    return job.id();
  }

  /**
   * Returns the job as it looks after this claim is applied.
   *
   * @return the post-claim job
   */
  public Job claimedJob() {
    return job.toBuilder()
        .nextRunAt(nextRunAt)
        .active(active)
        .lastRunMarker(newMarker)
        .build();
  }
}
