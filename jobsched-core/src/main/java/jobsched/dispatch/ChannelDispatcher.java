package jobsched.dispatch;

import jobsched.Job;
import jobsched.JobListener;
import jobsched.registry.ChannelRegistry;
import jobsched.spi.MetricsExporter;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Emits claimed job occurrences to the listeners of the job's channel.
 *
 * <p>When an allow-list of emitting channels is configured, occurrences on other channels
 * are withheld; an empty allow-list emits on every channel. Listeners run sequentially on
 * the calling thread; a failing listener is logged and does not prevent the remaining
 * listeners from running.
 *
 * @see ChannelRegistry
 * @see JobListener
 */
public final class ChannelDispatcher {
  private static final Logger logger = Logger.getLogger(ChannelDispatcher.class.getName());

  private final ChannelRegistry channelRegistry;
  private final Set<String> emittingChannels;
  private final MetricsExporter metrics;

  public ChannelDispatcher(ChannelRegistry channelRegistry, Collection<String> emittingChannels,
      MetricsExporter metrics) {
    this.channelRegistry = Objects.requireNonNull(channelRegistry, "channelRegistry");
    this.emittingChannels = emittingChannels == null ? Set.of() : Set.copyOf(emittingChannels);
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  /**
   * Returns {@code true} if occurrences on the channel are emitted by this dispatcher.
   *
   * @param channel the channel name
   * @return whether the channel passes the allow-list
   */
  public boolean isEmitting(String channel) {
    return emittingChannels.isEmpty() || emittingChannels.contains(channel);
  }

  public Set<String> emittingChannels() {
    return emittingChannels;
  }

  /**
   * Delivers a claimed occurrence to the listeners of its channel.
   *
   * @param job the job in its post-claim state
   * @return {@code true} if the occurrence was emitted, {@code false} if its channel is filtered out
   */
  public boolean dispatch(Job job) {
    String channel = job.channel();
    if (!isEmitting(channel)) {
      metrics.incrementEmitSuppressed();
      logger.log(Level.FINE, "Channel {0} not emitting, skipping job {1}",
          new Object[]{channel, job.name()});
      return false;
    }

    List<JobListener> listeners = channelRegistry.listenersFor(channel);
    if (listeners.isEmpty()) {
      logger.log(Level.FINE, "No listeners on channel {0} for job {1}",
          new Object[]{channel, job.name()});
    }
    for (JobListener listener : listeners) {
      try {
        listener.onJob(job);
      } catch (Exception e) {
        metrics.incrementListenerFailure();
        logger.log(Level.WARNING, "Listener failed for job " + job.name() + " on channel " + channel, e);
      }
    }
    metrics.incrementEmitted();
    return true;
  }
}
