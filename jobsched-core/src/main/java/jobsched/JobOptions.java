package jobsched;

import java.time.Instant;

/**
 * Optional settings applied when creating a job through the scheduler.
 *
 * <pre>{@code
 * scheduler.createOnetimeJob("invoice-42", runAt, JobOptions.builder()
 *     .channel("billing")
 *     .params("{\"invoiceId\":42}")
 *     .build());
 * }</pre>
 *
 * @see jobsched.engine.JobScheduler#createRecurringJob
 * @see jobsched.engine.JobScheduler#createOnetimeJob
 */
public final class JobOptions {
    private static final JobOptions DEFAULTS = builder().build();

    private final Instant startDate;
    private final Instant endDate;
    private final String channel;
    private final String params;

    private JobOptions(Builder builder) {
        this.startDate = builder.startDate;
        this.endDate = builder.endDate;
        this.channel = builder.channel;
        this.params = builder.params;
        if (startDate != null && endDate != null && endDate.isBefore(startDate)) {
            throw new IllegalArgumentException("endDate must not be before startDate");
        }
    }

    /**
     * Returns options with every value unset.
     *
     * @return the default options
     */
    public static JobOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Instant startDate() {
        return startDate;
    }

    public Instant endDate() {
        return endDate;
    }

    public String channel() {
        return channel;
    }

    public String params() {
        return params;
    }

    /**
     * Builder for {@link JobOptions}.
     */
    public static final class Builder {
        private Instant startDate;
        private Instant endDate;
        private String channel;
        private String params;

        private Builder() {
        }

        /**
         * Sets the start of the validity window.
         *
         * <p>Optional. Defaults to the creation time.
         *
         * @param startDate the start date
         * @return this builder
         */
        public Builder startDate(Instant startDate) {
            this.startDate = startDate;
            return this;
        }

        /**
         * Sets the end of the validity window.
         *
         * <p>Optional. Defaults to {@code null} (unbounded).
         *
         * @param endDate the end date
         * @return this builder
         */
        public Builder endDate(Instant endDate) {
            this.endDate = endDate;
            return this;
        }

        /**
         * Sets the channel the job's occurrences are emitted on.
         *
         * <p>Optional. Defaults to the scheduler's default channel.
         *
         * @param channel the channel name
         * @return this builder
         */
        public Builder channel(String channel) {
            this.channel = channel;
            return this;
        }

        /**
         * Attaches free-form parameters (typically JSON) delivered with every occurrence.
         *
         * @param params the parameters
         * @return this builder
         */
        public Builder params(String params) {
            this.params = params;
            return this;
        }

        /**
         * Builds the options.
         *
         * @return new options
         * @throws IllegalArgumentException if {@code endDate} is before {@code startDate}
         */
        public JobOptions build() {
            return new JobOptions(this);
        }
    }
}
