/**
 * Listener routing by channel name.
 *
 * @see jobsched.registry.ChannelRegistry
 * @see jobsched.registry.DefaultChannelRegistry
 */
package jobsched.registry;
