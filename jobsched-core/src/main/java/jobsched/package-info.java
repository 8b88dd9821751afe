/**
 * Multi-instance job scheduler core.
 *
 * <p>Jobs are defined once in a shared {@link jobsched.spi.JobStore}. Every scheduler process
 * polls the store, and a compare-and-swap on each job's marker ensures that an occurrence is
 * emitted by at most one process.
 *
 * <ul>
 *   <li>{@link jobsched.Job} / {@link jobsched.JobOptions}: job definitions</li>
 *   <li>{@link jobsched.engine.JobScheduler}: creation API and scheduling loop</li>
 *   <li>{@link jobsched.registry.DefaultChannelRegistry}: channel listeners</li>
 *   <li>{@link jobsched.dispatch.ChannelDispatcher}: emission with channel filtering</li>
 * </ul>
 */
package jobsched;
