package jobsched.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonThreadFactoryTest {

    @Test
    void namesTickThreadsSequentially() {
        DaemonThreadFactory factory = new DaemonThreadFactory("billing-");

        Thread first = factory.newThread(() -> { });
        Thread second = factory.newThread(() -> { });

        assertEquals("billing-tick-1", first.getName());
        assertEquals("billing-tick-2", second.getName());
        assertTrue(first.isDaemon());
        assertNotSame(first.getThreadGroup(), first.getUncaughtExceptionHandler());
    }

    @Test
    void rejectsNullPrefix() {
        assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
    }
}
