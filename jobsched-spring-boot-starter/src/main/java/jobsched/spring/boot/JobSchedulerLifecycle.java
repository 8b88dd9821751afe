package jobsched.spring.boot;

import jobsched.engine.JobScheduler;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the {@link JobScheduler} once the application context has refreshed, so that
 * schema initialization and listener registration happen before the first tick.
 */
public class JobSchedulerLifecycle implements SmartLifecycle {
    private final JobScheduler scheduler;

    public JobSchedulerLifecycle(JobScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void start() {
        scheduler.start();
    }

    @Override
    public void stop() {
        scheduler.stop();
    }

    @Override
    public boolean isRunning() {
        return scheduler.isRunning();
    }
}
