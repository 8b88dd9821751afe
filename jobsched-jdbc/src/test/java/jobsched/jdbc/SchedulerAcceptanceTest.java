package jobsched.jdbc;

import jobsched.Job;
import jobsched.JobOptions;
import jobsched.cron.CronUtilsEvaluator;
import jobsched.engine.JobScheduler;
import jobsched.jdbc.store.H2JobStore;
import jobsched.registry.DefaultChannelRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import javax.sql.DataSource;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * End-to-end runs of several schedulers sharing one H2 database in real time.
 */
class SchedulerAcceptanceTest {
    private DataSource dataSource;
    private final List<Job> fired = new CopyOnWriteArrayList<>();
    private final List<JobScheduler> schedulers = new ArrayList<>();

    @BeforeEach
    void setup() throws Exception {
        dataSource = TestDatabases.h2("acceptance");
    }

    @AfterEach
    void teardown() {
        schedulers.forEach(JobScheduler::close);
    }

    private JobScheduler newScheduler(String... emittingChannels) {
        JobScheduler scheduler = JobScheduler.builder()
                .jobStore(new H2JobStore(new DataSourceConnectionProvider(dataSource)))
                .cronEvaluator(new CronUtilsEvaluator())
                .channelRegistry(new DefaultChannelRegistry().registerAll(fired::add))
                .emittingChannels(emittingChannels)
                .build();
        schedulers.add(scheduler);
        return scheduler;
    }

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void recurringJobFiresOncePerOccurrenceAcrossInstances() throws Exception {
        JobScheduler first = newScheduler();
        JobScheduler second = newScheduler();
        JobScheduler third = newScheduler();
        first.createRecurringJob("every5s", "*/5 * * * * *");

        first.start();
        second.start();
        third.start();
        Thread.sleep(25_000);

        int count = fired.size();
        assertTrue(count >= 4 && count <= 5, "expected 4-5 occurrences but got " + count);
        Set<Instant> occurrences = new HashSet<>();
        for (Job job : fired) {
            assertEquals("every5s", job.name());
            assertTrue(occurrences.add(job.nextRunAt()), "occurrence emitted twice: " + job.nextRunAt());
        }
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    void onetimeJobFiresExactlyOnce() throws Exception {
        JobScheduler first = newScheduler();
        JobScheduler second = newScheduler();
        first.createOnetimeJob("x", Instant.now().plusSeconds(3),
                JobOptions.builder().params("{\"id\":7}").build());

        first.start();
        second.start();
        Thread.sleep(9_000);

        assertEquals(1, fired.size());
        assertEquals("{\"id\":7}", fired.get(0).params());
        Job stored = first.findJobByName("x").orElseThrow();
        assertFalse(stored.active());
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    void filteredChannelIsAdvancedButNotEmitted() throws Exception {
        JobScheduler scheduler = newScheduler("A", "B");
        scheduler.createOnetimeJob("c-job", Instant.now().plusSeconds(1),
                JobOptions.builder().channel("C").build());

        scheduler.start();
        Thread.sleep(4_000);

        assertTrue(fired.isEmpty());
        assertFalse(scheduler.findJobByName("c-job").orElseThrow().active());
    }
}
