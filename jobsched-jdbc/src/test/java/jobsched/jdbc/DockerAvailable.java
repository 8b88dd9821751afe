package jobsched.jdbc;

import org.junit.jupiter.api.extension.ConditionEvaluationResult;
import org.junit.jupiter.api.extension.ExecutionCondition;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.testcontainers.DockerClientFactory;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Skips the annotated container tests when no Docker daemon is reachable.
 */
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@ExtendWith(DockerAvailable.Condition.class)
@interface DockerAvailable {

  class Condition implements ExecutionCondition {
    @Override
    public ConditionEvaluationResult evaluateExecutionCondition(ExtensionContext context) {
      try {
        return DockerClientFactory.instance().isDockerAvailable()
            ? ConditionEvaluationResult.enabled("Docker daemon reachable")
            : ConditionEvaluationResult.disabled("Docker daemon not reachable");
      } catch (Throwable t) {
        return ConditionEvaluationResult.disabled("Docker check failed: " + t.getMessage());
      }
    }
  }
}
