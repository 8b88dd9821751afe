package jobsched;

/**
 * Thrown when a recurring job is created without a cron expression.
 */
public final class MissingCronExpressionException extends JobSchedulerException {

    public MissingCronExpressionException(String jobName) {
        super("cron expression is required for creating a recurring job: " + jobName);
    }
}
