package jobsched;

/**
 * Thrown when a cron expression cannot be parsed or has no future occurrence.
 */
public final class InvalidCronExpressionException extends JobSchedulerException {
    private final String expression;

    public InvalidCronExpressionException(String expression, Throwable cause) {
        super("Invalid cron expression: " + expression, cause);
        this.expression = expression;
    }

    public InvalidCronExpressionException(String expression, String reason) {
        super("Invalid cron expression: " + expression + " (" + reason + ")");
        this.expression = expression;
    }

    public String expression() {
        return expression;
    }
}
