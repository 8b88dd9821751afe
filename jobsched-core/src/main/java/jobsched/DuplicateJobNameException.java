package jobsched;

/**
 * Thrown when a job is created with a name that already exists in the store.
 */
public final class DuplicateJobNameException extends JobSchedulerException {
    private final String jobName;

    public DuplicateJobNameException(String jobName) {
        super("Duplicate job: " + jobName);
        this.jobName = jobName;
    }

    public DuplicateJobNameException(String jobName, Throwable cause) {
        super("Duplicate job: " + jobName, cause);
        this.jobName = jobName;
    }

    public String jobName() {
        return jobName;
    }
}
