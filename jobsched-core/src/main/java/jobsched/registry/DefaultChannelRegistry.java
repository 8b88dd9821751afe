package jobsched.registry;

import jobsched.JobListener;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe registry of job listeners keyed by channel.
 *
 * <p>Supports registration by channel name or wildcard ("*") for every channel.
 * Listeners are invoked in registration order.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ChannelRegistry registry = new DefaultChannelRegistry()
 *     .register("jobs", job -> worker.run(job))
 *     .register("reports", job -> reports.generate(job.params()))
 *
 *     // Wildcard listener for audit/logging
 *     .registerAll(job -> audit.log(job));
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Registrations may be made concurrently with dispatch; lookups return consistent
 * snapshots.
 *
 * @see JobListener
 * @see ChannelRegistry
 */
public final class DefaultChannelRegistry implements ChannelRegistry {
  public static final String ALL_CHANNELS = "*";

  private final Map<String, CopyOnWriteArrayList<JobListener>> listeners = new ConcurrentHashMap<>();

  /**
   * Registers a listener for a channel.
   *
   * @param channel the channel name
   * @param listener the listener
   * @return this registry for chaining
   */
  public DefaultChannelRegistry register(String channel, JobListener listener) {
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(listener, "listener");
    listeners.computeIfAbsent(channel, ignored -> new CopyOnWriteArrayList<>()).add(listener);
    return this;
  }

  /**
   * Registers a listener for all channels (wildcard).
   *
   * @param listener the listener
   * @return this registry for chaining
   */
  public DefaultChannelRegistry registerAll(JobListener listener) {
    return register(ALL_CHANNELS, listener);
  }

  /**
   * Removes a previously registered listener from a channel.
   *
   * @param channel the channel name, or {@link #ALL_CHANNELS}
   * @param listener the listener to remove
   * @return {@code true} if the listener was registered
   */
  public boolean unregister(String channel, JobListener listener) {
    CopyOnWriteArrayList<JobListener> registered = listeners.get(channel);
    return registered != null && registered.remove(listener);
  }

  /**
   * Removes every listener from every channel.
   */
  public void clear() {
    listeners.clear();
  }

  @Override
  public List<JobListener> listenersFor(String channel) {
    List<JobListener> result = new ArrayList<>();
    CopyOnWriteArrayList<JobListener> specific = listeners.get(channel);
    if (specific != null) {
      result.addAll(specific);
    }
    if (!ALL_CHANNELS.equals(channel)) {
      CopyOnWriteArrayList<JobListener> all = listeners.get(ALL_CHANNELS);
      if (all != null) {
        result.addAll(all);
      }
    }
    return Collections.unmodifiableList(result);
  }
}
