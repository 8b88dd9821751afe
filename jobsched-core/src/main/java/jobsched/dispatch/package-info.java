/**
 * Channel-filtered delivery of claimed occurrences to registered listeners.
 *
 * @see jobsched.dispatch.ChannelDispatcher
 */
package jobsched.dispatch;
