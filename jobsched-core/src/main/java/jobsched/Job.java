package jobsched;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable job definition as stored in the backing {@linkplain jobsched.spi.JobStore store}.
 *
 * <p>A job is <em>recurring</em> when it carries a cron expression and <em>one-time</em>
 * otherwise. One-time jobs retire ({@code active=false}, {@code nextRunAt=null}) after
 * their single occurrence is claimed.
 *
 * <p>{@link #lastRunMarker()} is a version token compared during claims. It changes on every
 * successful claim and must not be read as an audit "last fired at" value.
 *
 * <p>Instances delivered to {@link JobListener}s carry the post-claim state, so
 * {@link #nextRunAt()} is the schedule that applies going forward.
 *
 * @see jobsched.engine.JobScheduler
 * @see jobsched.spi.JobStore
 */
public final class Job {
    private final Long id;
    private final String name;
    private final String channel;
    private final boolean active;
    private final String cronExpression;
    private final Instant nextRunAt;
    private final long lastRunMarker;
    private final Instant startDate;
    private final Instant endDate;
    private final String params;
    private final Instant createdAt;

    private Job(Builder builder) {
        this.id = builder.id;
        this.name = Objects.requireNonNull(builder.name, "name");
        if (this.name.isEmpty()) {
            throw new IllegalArgumentException("name cannot be empty");
        }
        this.channel = Objects.requireNonNull(builder.channel, "channel");
        this.active = builder.active;
        this.cronExpression = builder.cronExpression;
        this.nextRunAt = builder.nextRunAt;
        this.lastRunMarker = builder.lastRunMarker;
        this.startDate = Objects.requireNonNull(builder.startDate, "startDate");
        this.endDate = builder.endDate;
        this.params = builder.params;
        this.createdAt = builder.createdAt;
    }

    /**
     * Creates a builder for a job with the given name.
     *
     * @param name the unique job name
     * @return a new builder
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Returns a builder pre-populated with this job's state.
     *
     * @return a new builder
     */
    public Builder toBuilder() {
        return new Builder(name)
                .id(id)
                .channel(channel)
                .active(active)
                .cronExpression(cronExpression)
                .nextRunAt(nextRunAt)
                .lastRunMarker(lastRunMarker)
                .startDate(startDate)
                .endDate(endDate)
                .params(params)
                .createdAt(createdAt);
    }

    /**
     * Returns the store-assigned identity, or {@code null} before the job is persisted.
     *
     * @return the job id, or {@code null}
     */
    public Long id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String channel() {
        return channel;
    }

    public boolean active() {
        return active;
    }

    public String cronExpression() {
        return cronExpression;
    }

    /**
     * Returns {@code true} if this job has a cron expression.
     *
     * @return whether the job recurs
     */
    public boolean isRecurring() {
        return cronExpression != null && !cronExpression.isBlank();
    }

    /**
     * Returns the next instant at which this job is due, or {@code null} if it never runs again.
     *
     * @return the next run instant, or {@code null}
     */
    public Instant nextRunAt() {
        return nextRunAt;
    }

    public long lastRunMarker() {
        return lastRunMarker;
    }

    public Instant startDate() {
        return startDate;
    }

    /**
     * Returns the end of the validity window, or {@code null} when unbounded.
     *
     * @return the end date, or {@code null}
     */
    public Instant endDate() {
        return endDate;
    }

    /**
     * Returns the free-form parameters attached at creation (typically JSON), or {@code null}.
     *
     * @return the job parameters, or {@code null}
     */
    public String params() {
        return params;
    }

    public Instant createdAt() {
        return createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Job other)) return false;
        return active == other.active
                && lastRunMarker == other.lastRunMarker
                && Objects.equals(id, other.id)
                && name.equals(other.name)
                && channel.equals(other.channel)
                && Objects.equals(cronExpression, other.cronExpression)
                && Objects.equals(nextRunAt, other.nextRunAt)
                && startDate.equals(other.startDate)
                && Objects.equals(endDate, other.endDate)
                && Objects.equals(params, other.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, channel, active, cronExpression, nextRunAt, lastRunMarker);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Job{id=").append(id)
                .append(", name=").append(name)
                .append(", channel=").append(channel)
                .append(", active=").append(active);
        if (cronExpression != null) {
            sb.append(", cronExpression=").append(cronExpression);
        }
        return sb.append(", nextRunAt=").append(nextRunAt)
                .append(", lastRunMarker=").append(lastRunMarker)
                .append('}').toString();
    }

    /**
     * Builder for {@link Job}.
     */
    public static final class Builder {
        private final String name;
        private Long id;
        private String channel;
        private boolean active = true;
        private String cronExpression;
        private Instant nextRunAt;
        private long lastRunMarker;
        private Instant startDate;
        private Instant endDate;
        private String params;
        private Instant createdAt;

        private Builder(String name) {
            this.name = name;
        }

        public Builder id(Long id) {
            this.id = id;
            return this;
        }

        /**
         * Sets the channel occurrences are emitted on.
         *
         * <p><b>Required.</b> The scheduler fills in its default channel when creating jobs.
         *
         * @param channel the channel name
         * @return this builder
         */
        public Builder channel(String channel) {
            this.channel = channel;
            return this;
        }

        /**
         * Sets whether the job is still eligible to fire.
         *
         * <p>Optional. Defaults to {@code true}.
         *
         * @param active the active flag
         * @return this builder
         */
        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder cronExpression(String cronExpression) {
            this.cronExpression = cronExpression;
            return this;
        }

        public Builder nextRunAt(Instant nextRunAt) {
            this.nextRunAt = nextRunAt;
            return this;
        }

        public Builder lastRunMarker(long lastRunMarker) {
            this.lastRunMarker = lastRunMarker;
            return this;
        }

        /**
         * Sets the beginning of the validity window.
         *
         * <p><b>Required.</b>
         *
         * @param startDate the start date
         * @return this builder
         */
        public Builder startDate(Instant startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder endDate(Instant endDate) {
            this.endDate = endDate;
            return this;
        }

        public Builder params(String params) {
            this.params = params;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        /**
         * Builds an immutable {@link Job}.
         *
         * @return a new job
         * @throws NullPointerException     if {@code name}, {@code channel} or {@code startDate} is null
         * @throws IllegalArgumentException if {@code name} is empty
         */
        public Job build() {
            return new Job(this);
        }
    }
}
