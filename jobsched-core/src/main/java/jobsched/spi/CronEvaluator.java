package jobsched.spi;

import java.time.Instant;

/**
 * Computes the next occurrence of a cron expression.
 *
 * <p>Implementations are pure: the result depends only on the expression and reference
 * instant (and the implementation's fixed time zone).
 *
 * @see jobsched.cron.CronUtilsEvaluator
 */
@FunctionalInterface
public interface CronEvaluator {

    /**
     * Returns the first occurrence strictly after {@code reference}.
     *
     * @param expression the cron expression
     * @param reference  the reference instant
     * @return the next occurrence
     * @throws jobsched.InvalidCronExpressionException if the expression cannot be parsed
     *                                                 or has no future occurrence
     */
    Instant nextOccurrence(String expression, Instant reference);

    /**
     * Checks that an expression can be evaluated.
     *
     * <p>Default evaluates the expression against the current time.
     *
     * @param expression the cron expression
     * @throws jobsched.InvalidCronExpressionException if the expression is invalid
     */
    default void validate(String expression) {
        nextOccurrence(expression, Instant.now());
    }
}
