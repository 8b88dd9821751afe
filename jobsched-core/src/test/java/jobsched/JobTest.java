package jobsched;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobTest {
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void builderRequiresNameChannelAndStartDate() {
        assertThrows(NullPointerException.class, () -> Job.builder(null).channel("jobs").startDate(T0).build());
        assertThrows(IllegalArgumentException.class, () -> Job.builder("").channel("jobs").startDate(T0).build());
        assertThrows(NullPointerException.class, () -> Job.builder("x").startDate(T0).build());
        assertThrows(NullPointerException.class, () -> Job.builder("x").channel("jobs").build());
    }

    @Test
    void defaultsToActiveOnetimeJob() {
        Job job = Job.builder("x").channel("jobs").startDate(T0).build();

        assertTrue(job.active());
        assertFalse(job.isRecurring());
        assertNull(job.id());
        assertNull(job.endDate());
    }

    @Test
    void toBuilderCopiesEveryField() {
        Job job = Job.builder("x")
                .id(3L)
                .channel("reports")
                .cronExpression("0 15 * * *")
                .nextRunAt(T0.plusSeconds(60))
                .lastRunMarker(42)
                .startDate(T0)
                .endDate(T0.plusSeconds(3600))
                .params("{\"k\":1}")
                .createdAt(T0)
                .build();

        Job copy = job.toBuilder().build();

        assertEquals(job, copy);
        assertEquals(job.hashCode(), copy.hashCode());
        assertTrue(copy.isRecurring());
        assertNotEquals(job, job.toBuilder().lastRunMarker(43).build());
    }

    @Test
    void optionsRejectEndBeforeStart() {
        assertThrows(IllegalArgumentException.class, () -> JobOptions.builder()
                .startDate(T0)
                .endDate(T0.minusSeconds(1))
                .build());
    }
}
