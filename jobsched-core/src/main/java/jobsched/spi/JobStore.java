package jobsched.spi;

import jobsched.Job;
import jobsched.model.ClaimRequest;
import jobsched.model.ClaimResult;
import jobsched.model.JobQuery;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for job definitions shared by every scheduler process.
 *
 * <p>The store is the only shared mutable resource. All cross-process coordination rests
 * on {@link #claim}, which must be a single conditional update (compare-and-swap on the
 * job's marker), never a read followed by a write.
 *
 * @see jobsched.jdbc.store.AbstractJdbcJobStore
 */
public interface JobStore {

    /**
     * Persists a new job and assigns its identity.
     *
     * @param job the job to insert; its {@code id} is ignored
     * @return the stored job with its assigned id
     * @throws jobsched.DuplicateJobNameException if a job with the same name exists
     */
    Job create(Job job);

    /**
     * Returns the jobs due within the given horizon: active, with
     * {@code nextRunAt <= now + horizon}, {@code startDate <= now} and
     * {@code endDate} unset or {@code >= now}.
     *
     * @param now     the current time
     * @param horizon how far ahead to look
     * @return due jobs in no particular order
     */
    List<Job> loadDue(Instant now, Duration horizon);

    /**
     * Atomically applies the request's new state only if the job's stored marker still
     * equals {@link ClaimRequest#expectedMarker()}.
     *
     * @param request the claim request
     * @return {@link ClaimResult#won} with the updated job, or {@link ClaimResult#lost()}
     *         if the marker changed or the job no longer exists
     */
    ClaimResult claim(ClaimRequest request);

    Optional<Job> findByName(String name);

    /**
     * Deletes the job with the given name.
     *
     * @param name the job name
     * @return {@code true} if a job was deleted
     */
    boolean removeByName(String name);

    /**
     * Deletes every job matching the query. Administrative; not used while scheduling.
     *
     * @param query the selection criteria
     * @return the number of jobs deleted
     */
    int purge(JobQuery query);
}
