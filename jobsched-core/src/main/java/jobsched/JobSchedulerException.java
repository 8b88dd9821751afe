package jobsched;

/**
 * Base class for errors raised by the job scheduler API.
 */
public class JobSchedulerException extends RuntimeException {

    public JobSchedulerException(String message) {
        super(message);
    }

    public JobSchedulerException(String message, Throwable cause) {
        super(message, cause);
    }
}
