package jobsched;

/**
 * Listener that receives job occurrences emitted on a channel.
 *
 * <h2>Execution Model</h2>
 * <p>Listeners run <b>synchronously</b> on the scheduler's tick thread, after this process
 * has won the claim for the occurrence. A slow listener delays the next tick.
 *
 * <h2>Error Handling</h2>
 * <p>An exception thrown by a listener is logged and counted; it does not stop other
 * listeners or other due jobs. The occurrence is <b>not</b> retried: the claim already
 * advanced the job's schedule.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * registry.register("billing", job -> invoiceService.run(job.params()));
 * }</pre>
 *
 * @see jobsched.registry.ChannelRegistry
 * @see jobsched.registry.DefaultChannelRegistry
 */
@FunctionalInterface
public interface JobListener {

    /**
     * Handles one occurrence of a job.
     *
     * @param job the job in its post-claim state
     * @throws Exception if handling fails; the failure is logged by the dispatcher
     */
    void onJob(Job job) throws Exception;
}
