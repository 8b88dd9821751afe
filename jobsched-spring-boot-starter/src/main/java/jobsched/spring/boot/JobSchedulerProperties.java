package jobsched.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the job scheduler.
 *
 * @see JobSchedulerAutoConfiguration
 */
@ConfigurationProperties(prefix = "jobsched")
public class JobSchedulerProperties {

    /**
     * Channel assigned to jobs created without one.
     */
    private String defaultChannelName = "jobs";

    /**
     * Seconds between working-set reloads; also the look-ahead horizon of each reload.
     */
    private long reloadIntervalSeconds = 10;

    /**
     * Channels this instance emits on. Empty means every channel.
     */
    private List<String> emittingChannels = new ArrayList<>();

    /**
     * Database table holding job definitions.
     */
    private String tableName = "scheduled_job";

    /**
     * Start scheduling when the application context starts.
     */
    private boolean autoStart = true;

    /**
     * Time zone cron expressions are evaluated in.
     */
    private String zone = "UTC";

    private final Tick tick = new Tick();
    private final Metrics metrics = new Metrics();

    public String getDefaultChannelName() {
        return defaultChannelName;
    }

    public void setDefaultChannelName(String defaultChannelName) {
        this.defaultChannelName = defaultChannelName;
    }

    public long getReloadIntervalSeconds() {
        return reloadIntervalSeconds;
    }

    public void setReloadIntervalSeconds(long reloadIntervalSeconds) {
        this.reloadIntervalSeconds = reloadIntervalSeconds;
    }

    public List<String> getEmittingChannels() {
        return emittingChannels;
    }

    public void setEmittingChannels(List<String> emittingChannels) {
        this.emittingChannels = emittingChannels;
    }

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public Tick getTick() {
        return tick;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /**
     * Randomized pause between scheduler ticks.
     */
    public static class Tick {
        private long minDelayMs = 500;
        private long maxDelayMs = 900;
        private long fixedDelayMs = 100;

        public long getMinDelayMs() {
            return minDelayMs;
        }

        public void setMinDelayMs(long minDelayMs) {
            this.minDelayMs = minDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }

        public long getFixedDelayMs() {
            return fixedDelayMs;
        }

        public void setFixedDelayMs(long fixedDelayMs) {
            this.fixedDelayMs = fixedDelayMs;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "jobsched";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
