package jobsched.engine;

import jobsched.Job;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A scheduler's private cache of jobs due within the current reload horizon,
 * kept sorted by {@code nextRunAt} ascending.
 *
 * <p>Not thread-safe: owned and mutated by the scheduler's tick thread only.
 */
final class WorkingSet {
    static final Comparator<Job> BY_NEXT_RUN =
            Comparator.comparing(Job::nextRunAt, Comparator.nullsLast(Comparator.naturalOrder()));

    private final List<Job> jobs = new ArrayList<>();

    /**
     * Discards the current contents and holds the given jobs instead.
     */
    void replaceAll(Collection<Job> loaded) {
        jobs.clear();
        for (Job job : loaded) {
            if (job.nextRunAt() != null) {
                jobs.add(job);
            }
        }
        jobs.sort(BY_NEXT_RUN);
    }

    /**
     * Returns the jobs with {@code nextRunAt < now}, earliest first.
     */
    List<Job> dueBefore(Instant now) {
        List<Job> due = new ArrayList<>();
        for (Job job : jobs) {
            if (!job.nextRunAt().isBefore(now)) {
                break; // sorted: nothing further is due
            }
            due.add(job);
        }
        return due;
    }

    /**
     * Inserts a job at its sorted position, replacing any entry with the same id.
     */
    void insert(Job job) {
        Objects.requireNonNull(job.nextRunAt(), "nextRunAt");
        remove(job);
        int index = Collections.binarySearch(jobs, job, BY_NEXT_RUN);
        jobs.add(index < 0 ? -index - 1 : index, job);
    }

    boolean remove(Job job) {
        Long id = job.id();
        return jobs.removeIf(j -> id != null ? id.equals(j.id()) : j.name().equals(job.name()));
    }

    boolean removeByName(String name) {
        return jobs.removeIf(j -> j.name().equals(name));
    }

    int size() {
        return jobs.size();
    }

    List<Job> snapshot() {
        return List.copyOf(jobs);
    }
}
