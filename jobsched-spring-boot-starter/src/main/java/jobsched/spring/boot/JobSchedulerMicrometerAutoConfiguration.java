package jobsched.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import jobsched.micrometer.MicrometerMetricsExporter;
import jobsched.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * and {@code jobsched.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link JobSchedulerAutoConfiguration} so the {@link MetricsExporter}
 * bean is available to the scheduler.
 */
@AutoConfiguration(before = JobSchedulerAutoConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "jobsched.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(JobSchedulerProperties.class)
public class JobSchedulerMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, JobSchedulerProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
