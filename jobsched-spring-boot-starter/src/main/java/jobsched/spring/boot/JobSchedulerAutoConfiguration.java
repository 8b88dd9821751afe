package jobsched.spring.boot;

import jobsched.cron.CronUtilsEvaluator;
import jobsched.engine.JobScheduler;
import jobsched.jdbc.JdbcJobStores;
import jobsched.registry.DefaultChannelRegistry;
import jobsched.spi.CronEvaluator;
import jobsched.spi.JobStore;
import jobsched.spi.MetricsExporter;
import jobsched.util.JitteredDelay;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.ZoneId;

/**
 * Auto-configuration for the job scheduler.
 *
 * <p>Wires a {@link JobScheduler} over a JDBC job store detected from the {@link DataSource},
 * a cron-utils evaluator and a channel registry populated from
 * {@link JobChannelListener} beans. Scheduling starts with the application context unless
 * {@code jobsched.auto-start=false}.
 *
 * @see JobSchedulerProperties
 * @see JobSchedulerMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(JobScheduler.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(JobSchedulerProperties.class)
public class JobSchedulerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(JobStore.class)
  public JobStore jobStore(DataSource dataSource, JobSchedulerProperties props) {
    return JdbcJobStores.detect(dataSource, props.getTableName());
  }

  @Bean
  @ConditionalOnMissingBean(CronEvaluator.class)
  public CronEvaluator cronEvaluator(JobSchedulerProperties props) {
    return new CronUtilsEvaluator(ZoneId.of(props.getZone()));
  }

  @Bean
  @ConditionalOnMissingBean
  public DefaultChannelRegistry channelRegistry() {
    return new DefaultChannelRegistry();
  }

  @Bean
  @ConditionalOnMissingBean
  public JobChannelListenerRegistrar jobChannelListenerRegistrar(
      ListableBeanFactory beanFactory, DefaultChannelRegistry channelRegistry) {
    return new JobChannelListenerRegistrar(beanFactory, channelRegistry);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public JobScheduler jobScheduler(JobSchedulerProperties props,
      JobStore jobStore,
      CronEvaluator cronEvaluator,
      DefaultChannelRegistry channelRegistry,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<Clock> clockProvider) {
    JobSchedulerProperties.Tick tick = props.getTick();
    return JobScheduler.builder()
        .jobStore(jobStore)
        .cronEvaluator(cronEvaluator)
        .channelRegistry(channelRegistry)
        .defaultChannelName(props.getDefaultChannelName())
        .reloadIntervalSeconds(props.getReloadIntervalSeconds())
        .emittingChannels(props.getEmittingChannels())
        .tickDelay(new JitteredDelay(tick.getMinDelayMs(), tick.getMaxDelayMs(), tick.getFixedDelayMs()))
        .metrics(metricsProvider.getIfAvailable())
        .clock(clockProvider.getIfAvailable())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "jobsched", name = "auto-start", matchIfMissing = true)
  public JobSchedulerLifecycle jobSchedulerLifecycle(JobScheduler jobScheduler) {
    return new JobSchedulerLifecycle(jobScheduler);
  }
}
