package jobsched.model;

import jobsched.Job;

/**
 * Criteria selecting jobs for administrative operations such as
 * {@link jobsched.spi.JobStore#purge}. Unset criteria match every job.
 *
 * <pre>{@code
 * store.purge(JobQuery.all());
 * store.purge(JobQuery.builder().channel("reports").active(false).build());
 * }</pre>
 *
 * @param name    exact job name, or {@code null}
 * @param channel exact channel, or {@code null}
 * @param active  active flag, or {@code null}
 */
public record JobQuery(String name, String channel, Boolean active) {
  private static final JobQuery ALL = new JobQuery(null, null, null);

  public static JobQuery all() {
    return ALL;
  }

  public static JobQuery byName(String name) {
    return new JobQuery(name, null, null);
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean isUnrestricted() {
    return name == null && channel == null && active == null;
  }

  /**
   * Evaluates this query against a job, for stores that filter in memory.
   *
   * @param job the candidate job
   * @return {@code true} if every set criterion matches
   */
  public boolean matches(Job job) {
    return (name == null || name.equals(job.name()))
        && (channel == null || channel.equals(job.channel()))
        && (active == null || active == job.active());
  }

  /** Builder for {@link JobQuery}. */
  public static final class Builder {
    private String name;
    private String channel;
    private Boolean active;

    private Builder() {}

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder channel(String channel) {
      this.channel = channel;
      return this;
    }

    public Builder active(Boolean active) {
      this.active = active;
      return this;
    }

    public JobQuery build() {
      return new JobQuery(name, channel, active);
    }
  }
}
