package jobsched.engine;

import jobsched.Job;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkingSetTest {
  private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

  private static Job job(long id, String name, Instant nextRunAt) {
    return Job.builder(name).id(id).channel("jobs").startDate(T0).nextRunAt(nextRunAt).build();
  }

  @Test
  void replaceAllSortsAndSkipsJobsWithoutNextRun() {
    WorkingSet set = new WorkingSet();
    set.replaceAll(List.of(
        job(1, "c", T0.plusSeconds(30)),
        job(2, "a", T0.plusSeconds(10)),
        job(3, "retired", null),
        job(4, "b", T0.plusSeconds(20))));

    List<Job> snapshot = set.snapshot();
    assertEquals(3, snapshot.size());
    assertEquals(List.of("a", "b", "c"), snapshot.stream().map(Job::name).toList());
  }

  @Test
  void dueBeforeStopsAtFirstFutureJob() {
    WorkingSet set = new WorkingSet();
    set.replaceAll(List.of(
        job(1, "a", T0.plusSeconds(1)),
        job(2, "b", T0.plusSeconds(2)),
        job(3, "c", T0.plusSeconds(5))));

    List<Job> due = set.dueBefore(T0.plusSeconds(5));

    assertEquals(List.of("a", "b"), due.stream().map(Job::name).toList());
    assertEquals(3, set.size());
  }

  @Test
  void insertReplacesEntryWithSameIdAtSortedPosition() {
    WorkingSet set = new WorkingSet();
    set.replaceAll(List.of(
        job(1, "a", T0.plusSeconds(1)),
        job(2, "b", T0.plusSeconds(5))));

    set.insert(job(1, "a", T0.plusSeconds(9)));

    assertEquals(2, set.size());
    assertEquals(List.of("b", "a"), set.snapshot().stream().map(Job::name).toList());
  }

  @Test
  void removeByName() {
    WorkingSet set = new WorkingSet();
    set.replaceAll(List.of(job(1, "a", T0), job(2, "b", T0)));

    assertTrue(set.removeByName("a"));
    assertEquals(List.of("b"), set.snapshot().stream().map(Job::name).toList());
  }
}
