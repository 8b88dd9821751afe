package jobsched.engine;

import jobsched.DuplicateJobNameException;
import jobsched.InvalidCronExpressionException;
import jobsched.Job;
import jobsched.JobOptions;
import jobsched.MissingCronExpressionException;
import jobsched.dispatch.ChannelDispatcher;
import jobsched.model.ClaimRequest;
import jobsched.model.ClaimResult;
import jobsched.model.JobQuery;
import jobsched.registry.ChannelRegistry;
import jobsched.spi.CronEvaluator;
import jobsched.spi.JobStore;
import jobsched.spi.MetricsExporter;
import jobsched.util.DaemonThreadFactory;
import jobsched.util.JitteredDelay;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Poll-based job scheduler that fires each due occurrence from at most one of the
 * scheduler processes sharing a {@link JobStore}.
 *
 * <p>Each tick of the scheduling loop:
 * <ol>
 *   <li>reloads the working set from {@link JobStore#loadDue} once the reload interval has
 *       elapsed (the horizon equals the interval, so every job due before the next reload
 *       is already resident);</li>
 *   <li>collects the jobs whose {@code nextRunAt} has passed, earliest first;</li>
 *   <li>for each, computes the next schedule and sends a {@link ClaimRequest} to the store.
 *       The store's conditional update lets exactly one process win. The job leaves the
 *       working set either way; the winner emits the occurrence on the job's channel and
 *       re-inserts the updated job, the loser stays silent until its next reload.</li>
 * </ol>
 * Ticks are separated by a {@linkplain JitteredDelay randomized delay}.
 *
 * <p>A crash between a won claim and dispatch loses that occurrence: delivery is
 * at-most-once.
 *
 * <p>Create instances via {@link #builder()}. Job creation and removal may be called from
 * any thread; the working set is only touched by the tick thread.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * DefaultChannelRegistry registry = new DefaultChannelRegistry()
 *     .register("jobs", job -> System.out.println("fired " + job.name()));
 *
 * try (JobScheduler scheduler = JobScheduler.builder()
 *     .jobStore(store)
 *     .cronEvaluator(new CronUtilsEvaluator())
 *     .channelRegistry(registry)
 *     .build()) {
 *   scheduler.createRecurringJob("nightly", "0 0 2 * * *", JobOptions.defaults());
 *   scheduler.start();
 *   ...
 * }
 * }</pre>
 *
 * @see JobScheduler.Builder
 * @see JobStore
 * @see ChannelDispatcher
 */
public final class JobScheduler implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(JobScheduler.class.getName());

    public static final String DEFAULT_CHANNEL = "jobs";
    public static final long DEFAULT_RELOAD_INTERVAL_SECONDS = 10;

    private final JobStore jobStore;
    private final CronEvaluator cronEvaluator;
    private final ChannelDispatcher dispatcher;
    private final MetricsExporter metrics;
    private final Clock clock;
    private final String defaultChannelName;
    private final Duration reloadInterval;
    private final JitteredDelay tickDelay;
    private final String threadNamePrefix;

    private final WorkingSet workingSet = new WorkingSet();
    private final Queue<String> pendingEvictions = new ConcurrentLinkedQueue<>();
    private final AtomicLong generation = new AtomicLong();
    private final Object tickLock = new Object();

    private Instant lastLoadTime;
    private volatile boolean reloadRequested = true;
    private volatile List<Job> workingSetSnapshot = List.of();

    private ExecutorService executor;
    private volatile boolean running;
    private volatile boolean closed;

    private JobScheduler(Builder builder) {
        this.jobStore = Objects.requireNonNull(builder.jobStore, "jobStore");
        this.cronEvaluator = Objects.requireNonNull(builder.cronEvaluator, "cronEvaluator");
        ChannelRegistry channelRegistry = Objects.requireNonNull(builder.channelRegistry, "channelRegistry");

        if (builder.reloadIntervalSeconds <= 0) {
            throw new IllegalArgumentException("reloadIntervalSeconds must be > 0");
        }
        String channel = builder.defaultChannelName;
        if (channel == null || channel.isEmpty()) {
            throw new IllegalArgumentException("defaultChannelName must not be empty");
        }

        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.defaultChannelName = channel;
        this.reloadInterval = Duration.ofSeconds(builder.reloadIntervalSeconds);
        this.tickDelay = builder.tickDelay != null ? builder.tickDelay : JitteredDelay.DEFAULT;
        this.threadNamePrefix = builder.threadNamePrefix;
        this.dispatcher = new ChannelDispatcher(channelRegistry, builder.emittingChannels, metrics);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ── Job definition API ──────────────────────────────────────────

    /**
     * Creates a recurring job whose first run is the next occurrence of {@code cronExpression}
     * after the later of now and the job's start date.
     *
     * @param name           unique job name
     * @param cronExpression the cron expression
     * @param options        optional window, channel and parameters
     * @return the stored job
     * @throws MissingCronExpressionException if {@code cronExpression} is null or blank
     * @throws InvalidCronExpressionException if {@code cronExpression} cannot be evaluated
     * @throws DuplicateJobNameException      if a job named {@code name} exists
     * @throws IllegalArgumentException       if no occurrence falls before the end date
     */
    public Job createRecurringJob(String name, String cronExpression, JobOptions options) {
        Objects.requireNonNull(name, "name");
        if (cronExpression == null || cronExpression.isBlank()) {
            throw new MissingCronExpressionException(name);
        }
        JobOptions opts = options != null ? options : JobOptions.defaults();
        Instant now = clock.instant();
        Instant startDate = opts.startDate() != null ? opts.startDate() : now;
        Instant reference = startDate.isAfter(now) ? startDate : now;

        Instant nextRunAt = evaluateCron(cronExpression, reference);
        if (opts.endDate() != null && nextRunAt.isAfter(opts.endDate())) {
            throw new IllegalArgumentException("Job " + name + " has no occurrence before endDate " + opts.endDate());
        }

        Job job = newJob(name, opts, startDate, now)
                .cronExpression(cronExpression)
                .nextRunAt(nextRunAt)
                .build();
        return persist(job);
    }

    public Job createRecurringJob(String name, String cronExpression) {
        return createRecurringJob(name, cronExpression, JobOptions.defaults());
    }

    /**
     * Creates a job that fires once at {@code runAt}.
     *
     * <p>Without an explicit start date the window opens at the earlier of now and {@code runAt}.
     *
     * @param name    unique job name
     * @param runAt   the instant the job is due
     * @param options optional window, channel and parameters
     * @return the stored job
     * @throws DuplicateJobNameException if a job named {@code name} exists
     * @throws IllegalArgumentException  if {@code runAt} lies outside the job's window
     */
    public Job createOnetimeJob(String name, Instant runAt, JobOptions options) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(runAt, "runAt");
        JobOptions opts = options != null ? options : JobOptions.defaults();
        Instant now = clock.instant();
        Instant startDate = opts.startDate() != null
                ? opts.startDate()
                : (runAt.isBefore(now) ? runAt : now);

        if (runAt.isBefore(startDate)) {
            throw new IllegalArgumentException("runAt must not be before startDate");
        }
        if (opts.endDate() != null && runAt.isAfter(opts.endDate())) {
            throw new IllegalArgumentException("runAt must not be after endDate");
        }

        Job job = newJob(name, opts, startDate, now)
                .nextRunAt(runAt)
                .build();
        return persist(job);
    }

    public Job createOnetimeJob(String name, Instant runAt) {
        return createOnetimeJob(name, runAt, JobOptions.defaults());
    }

    /**
     * Deletes a job from the store and drops it from this scheduler's working set.
     * Other schedulers drop it on their next reload.
     *
     * @param name the job name
     * @return {@code true} if a job was deleted
     */
    public boolean removeJobByName(String name) {
        Objects.requireNonNull(name, "name");
        boolean removed = jobStore.removeByName(name);
        if (isResident(name) && !pendingEvictions.contains(name)) {
            pendingEvictions.add(name);
        }
        return removed;
    }

    private boolean isResident(String name) {
        for (Job job : workingSetSnapshot) {
            if (job.name().equals(name)) {
                return true;
            }
        }
        return false;
    }

    int pendingEvictionCount() {
        return pendingEvictions.size();
    }

    public Optional<Job> findJobByName(String name) {
        return jobStore.findByName(name);
    }

    /**
     * Deletes every job matching the query. Jobs already in a working set are dropped when
     * their next claim finds no row.
     *
     * @param query the selection criteria
     * @return the number of jobs deleted
     */
    public int purgeJobs(JobQuery query) {
        return jobStore.purge(Objects.requireNonNull(query, "query"));
    }

    private Job.Builder newJob(String name, JobOptions opts, Instant startDate, Instant now) {
        String channel = opts.channel() != null && !opts.channel().isEmpty()
                ? opts.channel() : defaultChannelName;
        return Job.builder(name)
                .channel(channel)
                .active(true)
                .startDate(startDate)
                .endDate(opts.endDate())
                .params(opts.params())
                .lastRunMarker(now.toEpochMilli())
                .createdAt(now);
    }

    private Job persist(Job job) {
        if (jobStore.findByName(job.name()).isPresent()) {
            throw new DuplicateJobNameException(job.name());
        }
        Job stored = jobStore.create(job);
        logger.log(Level.FINE, "Created job {0} next run at {1}",
                new Object[]{stored.name(), stored.nextRunAt()});
        return stored;
    }

    private Instant evaluateCron(String expression, Instant reference) {
        try {
            return cronEvaluator.nextOccurrence(expression, reference);
        } catch (InvalidCronExpressionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new InvalidCronExpressionException(expression, e);
        }
    }

    // ── Scheduling ──────────────────────────────────────────────────

    /**
     * Runs a single scheduling pass: reload if needed, then claim and emit every due job.
     * Intended for driving a scheduler that is not started, e.g. from tests.
     *
     * @throws IllegalStateException if the scheduling loop is running
     */
    public void tick() {
        if (running) {
            throw new IllegalStateException("JobScheduler is running; tick() is driven by its loop");
        }
        runTick();
    }

    private void runTick() {
        synchronized (tickLock) {
            doTick();
        }
    }

    private void doTick() {
        Instant now = clock.instant();
        applyPendingEvictions();
        reloadIfNeeded(now);

        for (Job job : workingSet.dueBefore(now)) {
            processDueJob(job, now);
        }

        workingSetSnapshot = workingSet.snapshot();
        metrics.recordWorkingSetSize(workingSet.size());
    }

    private void applyPendingEvictions() {
        String name;
        while ((name = pendingEvictions.poll()) != null) {
            workingSet.removeByName(name);
        }
    }

    private void reloadIfNeeded(Instant now) {
        boolean intervalElapsed = lastLoadTime == null || now.isAfter(lastLoadTime.plus(reloadInterval));
        if (!reloadRequested && !intervalElapsed) {
            return;
        }
        reloadRequested = false;
        lastLoadTime = now;
        try {
            List<Job> loaded = jobStore.loadDue(now, reloadInterval);
            workingSet.replaceAll(loaded);
            metrics.incrementReload();
            logger.log(Level.FINE, "Loaded {0} jobs due within {1}", new Object[]{loaded.size(), reloadInterval});
        } catch (RuntimeException e) {
            metrics.incrementReloadFailure();
            logger.log(Level.SEVERE, "Failed to load due jobs; keeping previous working set", e);
        }
    }

    private void processDueJob(Job job, Instant now) {
        ClaimRequest request;
        try {
            request = nextClaim(job, now);
        } catch (InvalidCronExpressionException e) {
            // left untouched in the store; seen again after the next reload
            workingSet.remove(job);
            metrics.incrementClaimFailure();
            logger.log(Level.SEVERE, "Cannot schedule job " + job.name() + ": " + e.getMessage(), e);
            return;
        }

        ClaimResult result;
        try {
            result = jobStore.claim(request);
        } catch (RuntimeException e) {
            // job stays resident and is retried on the next pass
            metrics.incrementClaimFailure();
            logger.log(Level.SEVERE, "Failed to claim job " + job.name(), e);
            return;
        }

        workingSet.remove(job);

        if (!result.won()) {
            metrics.incrementClaimLost();
            logger.log(Level.FINE, "Claim lost for job {0}; another scheduler fired it", job.name());
            return;
        }

        metrics.incrementClaimWon();
        Job claimed = result.job();
        try {
            dispatcher.dispatch(claimed);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to dispatch job " + claimed.name(), e);
        }
        if (claimed.active() && claimed.nextRunAt() != null) {
            workingSet.insert(claimed);
        }
    }

    /**
     * Builds the claim for a due job. Recurring jobs advance to the next cron occurrence
     * after {@code now}; one-time jobs, and recurring jobs whose next occurrence falls after
     * their end date, retire.
     */
    ClaimRequest nextClaim(Job job, Instant now) {
        long newMarker = nextMarker(job.lastRunMarker(), now);
        if (!job.isRecurring()) {
            return ClaimRequest.of(job, newMarker, null);
        }
        Instant next = evaluateCron(job.cronExpression(), now);
        if (job.endDate() != null && next.isAfter(job.endDate())) {
            next = null;
        }
        return ClaimRequest.of(job, newMarker, next);
    }

    static long nextMarker(long previous, Instant now) {
        return Math.max(previous + 1, now.toEpochMilli());
    }

    /**
     * Returns the jobs resident in the working set as of the last completed tick,
     * sorted by {@code nextRunAt}.
     *
     * @return an immutable snapshot
     */
    public List<Job> workingSet() {
        return workingSetSnapshot;
    }

    // ── Lifecycle ───────────────────────────────────────────────────

    /**
     * Starts the scheduling loop on a daemon thread. The first tick reloads the working set.
     * Subsequent calls are no-ops while running; a stopped scheduler may be started again.
     *
     * @throws IllegalStateException if the scheduler has been closed
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("JobScheduler has been closed");
        }
        if (running) {
            return;
        }
        reloadRequested = true;
        running = true;
        long loopGeneration = generation.incrementAndGet();
        if (executor == null) {
            executor = Executors.newSingleThreadExecutor(new DaemonThreadFactory(threadNamePrefix));
        }
        executor.execute(() -> runLoop(loopGeneration));
        logger.log(Level.INFO, "Job scheduler started (reloadInterval={0}, tickDelay={1})",
                new Object[]{reloadInterval, tickDelay});
    }

    /**
     * Stops scheduling. A tick already in flight completes; no further tick starts.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        logger.log(Level.INFO, "Job scheduler stopping");
    }

    public boolean isRunning() {
        return running;
    }

    private boolean isCurrent(long loopGeneration) {
        return running && generation.get() == loopGeneration;
    }

    private void runLoop(long loopGeneration) {
        while (isCurrent(loopGeneration)) {
            try {
                runTick();
            } catch (Throwable t) {
                logger.log(Level.SEVERE, "Scheduler tick failed", t);
            }
            if (!isCurrent(loopGeneration)) {
                break;
            }
            try {
                Thread.sleep(tickDelay.nextDelayMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    /**
     * Stops scheduling and shuts down the loop thread, waiting briefly for an in-flight tick.
     */
    @Override
    public synchronized void close() {
        closed = true;
        running = false;
        if (executor != null) {
            executor.shutdownNow();
            try {
                executor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public String defaultChannelName() {
        return defaultChannelName;
    }

    public Duration reloadInterval() {
        return reloadInterval;
    }

    public Set<String> emittingChannels() {
        return dispatcher.emittingChannels();
    }

    /**
     * Builder for {@link JobScheduler}.
     */
    public static final class Builder {
        private JobStore jobStore;
        private CronEvaluator cronEvaluator;
        private ChannelRegistry channelRegistry;
        private String defaultChannelName = DEFAULT_CHANNEL;
        private long reloadIntervalSeconds = DEFAULT_RELOAD_INTERVAL_SECONDS;
        private Collection<String> emittingChannels;
        private MetricsExporter metrics;
        private Clock clock;
        private JitteredDelay tickDelay;
        private String threadNamePrefix = "jobsched-";

        private Builder() {
        }

        /**
         * Sets the store holding job definitions.
         *
         * <p><b>Required.</b>
         *
         * @param jobStore the persistence backend
         * @return this builder
         */
        public Builder jobStore(JobStore jobStore) {
            this.jobStore = jobStore;
            return this;
        }

        /**
         * Sets the evaluator computing next runs of recurring jobs.
         *
         * <p><b>Required.</b>
         *
         * @param cronEvaluator the cron evaluator
         * @return this builder
         */
        public Builder cronEvaluator(CronEvaluator cronEvaluator) {
            this.cronEvaluator = cronEvaluator;
            return this;
        }

        /**
         * Sets the registry of listeners receiving emitted occurrences.
         *
         * <p><b>Required.</b>
         *
         * @param channelRegistry the channel registry
         * @return this builder
         */
        public Builder channelRegistry(ChannelRegistry channelRegistry) {
            this.channelRegistry = channelRegistry;
            return this;
        }

        /**
         * Sets the channel assigned to jobs created without one.
         *
         * <p>Optional. Defaults to {@code "jobs"}.
         *
         * @param defaultChannelName the default channel
         * @return this builder
         */
        public Builder defaultChannelName(String defaultChannelName) {
            this.defaultChannelName = defaultChannelName;
            return this;
        }

        /**
         * Sets how often the working set is reloaded from the store. Also the look-ahead
         * horizon of each reload.
         *
         * <p>Optional. Defaults to {@code 10} seconds. Must be &gt; 0.
         *
         * @param reloadIntervalSeconds reload interval in seconds
         * @return this builder
         */
        public Builder reloadIntervalSeconds(long reloadIntervalSeconds) {
            this.reloadIntervalSeconds = reloadIntervalSeconds;
            return this;
        }

        /**
         * Restricts emission to the given channels. Occurrences on other channels are still
         * claimed and advanced but not emitted.
         *
         * <p>Optional. Defaults to none (emit on every channel).
         *
         * @param emittingChannels the channel allow-list
         * @return this builder
         */
        public Builder emittingChannels(Collection<String> emittingChannels) {
            this.emittingChannels = emittingChannels;
            return this;
        }

        public Builder emittingChannels(String... emittingChannels) {
            return emittingChannels(List.of(emittingChannels));
        }

        /**
         * Sets the metrics exporter.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets the clock used for due detection and job creation.
         *
         * <p>Optional. Defaults to {@link Clock#systemUTC()}.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Sets the randomized pause between ticks.
         *
         * <p>Optional. Defaults to {@link JitteredDelay#DEFAULT}.
         *
         * @param tickDelay the tick delay
         * @return this builder
         */
        public Builder tickDelay(JitteredDelay tickDelay) {
            this.tickDelay = tickDelay;
            return this;
        }

        public Builder threadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = Objects.requireNonNull(threadNamePrefix, "threadNamePrefix");
            return this;
        }

        /**
         * Builds the scheduler. Call {@link JobScheduler#start()} to begin scheduling.
         *
         * @return a new {@link JobScheduler}
         * @throws NullPointerException     if {@code jobStore}, {@code cronEvaluator} or
         *                                  {@code channelRegistry} is null
         * @throws IllegalArgumentException if {@code reloadIntervalSeconds <= 0} or
         *                                  {@code defaultChannelName} is empty
         */
        public JobScheduler build() {
            return new JobScheduler(this);
        }
    }
}
