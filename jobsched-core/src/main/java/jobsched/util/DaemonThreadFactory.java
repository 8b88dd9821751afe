package jobsched.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates the daemon threads that run scheduler tick loops.
 *
 * <p>Threads are named {@code <prefix>tick-1}, {@code <prefix>tick-2}, ... and log anything
 * that escapes the loop at {@code SEVERE}, naming the thread.
 */
public final class DaemonThreadFactory implements ThreadFactory {
    private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

    private final String prefix;
    private final AtomicInteger sequence = new AtomicInteger(1);

    public DaemonThreadFactory(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    @Override
    public Thread newThread(Runnable tickLoop) {
        Thread thread = new Thread(tickLoop, prefix + "tick-" + sequence.getAndIncrement());
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler((t, e) ->
                logger.log(Level.SEVERE, "Scheduler thread " + t.getName() + " terminated", e));
        return thread;
    }
}
