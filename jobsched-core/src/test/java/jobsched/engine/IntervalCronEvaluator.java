package jobsched.engine;

import jobsched.InvalidCronExpressionException;
import jobsched.spi.CronEvaluator;

import java.time.Instant;

/**
 * Understands only {@code "@every <n>s"}, firing on epoch-aligned multiples of n seconds.
 */
final class IntervalCronEvaluator implements CronEvaluator {

  @Override
  public Instant nextOccurrence(String expression, Instant reference) {
    if (!expression.startsWith("@every ") || !expression.endsWith("s")) {
      throw new InvalidCronExpressionException(expression, "unsupported format");
    }
    long seconds;
    try {
      seconds = Long.parseLong(expression.substring(7, expression.length() - 1));
    } catch (NumberFormatException e) {
      throw new InvalidCronExpressionException(expression, e);
    }
    long epoch = reference.getEpochSecond();
    return Instant.ofEpochSecond((epoch / seconds + 1) * seconds);
  }
}
