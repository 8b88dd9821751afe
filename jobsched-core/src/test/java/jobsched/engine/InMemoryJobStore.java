package jobsched.engine;

import jobsched.DuplicateJobNameException;
import jobsched.Job;
import jobsched.model.ClaimRequest;
import jobsched.model.ClaimResult;
import jobsched.model.JobQuery;
import jobsched.spi.JobStore;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Map-backed JobStore for unit tests that don't need real JDBC. Claims are atomic per job.
 */
class InMemoryJobStore implements JobStore {
  private final Map<Long, Job> jobs = new ConcurrentHashMap<>();
  private final AtomicLong ids = new AtomicLong();
  final AtomicInteger loadCount = new AtomicInteger();
  final AtomicInteger claimCount = new AtomicInteger();
  volatile RuntimeException loadFailure;
  final Map<String, RuntimeException> claimFailures = new ConcurrentHashMap<>();

  @Override
  public synchronized Job create(Job job) {
    if (findByName(job.name()).isPresent()) {
      throw new DuplicateJobNameException(job.name());
    }
    Job stored = job.toBuilder().id(ids.incrementAndGet()).build();
    jobs.put(stored.id(), stored);
    return stored;
  }

  @Override
  public List<Job> loadDue(Instant now, Duration horizon) {
    loadCount.incrementAndGet();
    if (loadFailure != null) {
      throw loadFailure;
    }
    Instant limit = now.plus(horizon);
    List<Job> due = new ArrayList<>();
    for (Job job : jobs.values()) {
      if (job.active()
          && job.nextRunAt() != null
          && !job.nextRunAt().isAfter(limit)
          && !job.startDate().isAfter(now)
          && (job.endDate() == null || !job.endDate().isBefore(now))) {
        due.add(job);
      }
    }
    return due;
  }

  @Override
  public ClaimResult claim(ClaimRequest request) {
    claimCount.incrementAndGet();
    RuntimeException failure = claimFailures.get(request.job().name());
    if (failure != null) {
      throw failure;
    }
    Job claimed = request.claimedJob();
    Job[] winner = new Job[1];
    jobs.computeIfPresent(request.jobId(), (id, current) -> {
      if (current.lastRunMarker() != request.expectedMarker()) {
        return current;
      }
      winner[0] = claimed;
      return claimed;
    });
    return winner[0] != null ? ClaimResult.won(winner[0]) : ClaimResult.lost();
  }

  @Override
  public Optional<Job> findByName(String name) {
    return jobs.values().stream().filter(j -> j.name().equals(name)).findFirst();
  }

  @Override
  public boolean removeByName(String name) {
    return jobs.values().removeIf(j -> j.name().equals(name));
  }

  @Override
  public int purge(JobQuery query) {
    int before = jobs.size();
    jobs.values().removeIf(query::matches);
    return before - jobs.size();
  }

  /** Overwrites a stored job, simulating a claim by another process. */
  void overwrite(Job job) {
    jobs.put(job.id(), job);
  }

  int size() {
    return jobs.size();
  }
}
