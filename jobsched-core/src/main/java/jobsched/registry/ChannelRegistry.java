package jobsched.registry;

import jobsched.JobListener;

import java.util.List;

/**
 * Registry for looking up job listeners by channel.
 *
 * <p>The dispatcher uses this registry to find every listener that should receive an
 * occurrence emitted on a channel. Listeners are returned in a deterministic order and
 * executed sequentially.
 *
 * @see JobListener
 * @see DefaultChannelRegistry
 */
public interface ChannelRegistry {

  /**
   * Returns all listeners registered for the given channel.
   *
   * <p>The returned list includes:
   * <ol>
   *   <li>Listeners registered for the exact channel</li>
   *   <li>Listeners registered for all channels (wildcard "*")</li>
   * </ol>
   *
   * @param channel the channel to look up
   * @return immutable list of matching listeners, may be empty
   */
  List<JobListener> listenersFor(String channel);
}
