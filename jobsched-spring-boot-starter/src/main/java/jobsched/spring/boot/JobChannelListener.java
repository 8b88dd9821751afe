package jobsched.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as a listener for job occurrences on a channel.
 *
 * <p>The annotated bean must implement {@link jobsched.JobListener}.
 *
 * <pre>{@code
 * @Component
 * @JobChannelListener("reports")
 * public class ReportJobs implements JobListener {
 *   public void onJob(Job job) { ... }
 * }
 * }</pre>
 *
 * @see JobChannelListenerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface JobChannelListener {

    /**
     * Channel names to listen on. {@code "*"} listens on every channel.
     */
    String[] value();
}
