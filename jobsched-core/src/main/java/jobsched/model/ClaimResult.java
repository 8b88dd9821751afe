package jobsched.model;

import jobsched.Job;

import java.util.Objects;

/**
 * Outcome of a {@link ClaimRequest}.
 *
 * <p>A lost claim is the expected result when another scheduler process already advanced
 * the job; it is not an error.
 *
 * @param won {@code true} if this process owns the occurrence
 * @param job the updated job when won, {@code null} when lost
 */
public record ClaimResult(boolean won, Job job) {
  private static final ClaimResult LOST = new ClaimResult(false, null);

  public ClaimResult {
    if (won) {
      Objects.requireNonNull(job, "job");
    } else if (job != null) {
      throw new IllegalArgumentException("lost claim carries no job");
    }
  }

  public static ClaimResult won(Job job) {
    return new ClaimResult(true, job);
  }

  public static ClaimResult lost() {
    return LOST;
  }
}
