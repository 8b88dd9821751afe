package jobsched.util;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Randomized pause between scheduler ticks: a uniform jitter in
 * {@code [minJitterMs, maxJitterMs]} plus a fixed gap.
 *
 * <p>Scheduler processes polling the same store with a fixed period would reload and claim
 * in lockstep; the jitter spreads their claim attempts over time.
 */
public final class JitteredDelay {
    /** 500-900 ms of jitter plus 100 ms. */
    public static final JitteredDelay DEFAULT = new JitteredDelay(500, 900, 100);

    private final long minJitterMs;
    private final long maxJitterMs;
    private final long fixedMs;

    public JitteredDelay(long minJitterMs, long maxJitterMs, long fixedMs) {
        if (minJitterMs < 0 || fixedMs < 0) {
            throw new IllegalArgumentException("delays must be >= 0");
        }
        if (maxJitterMs < minJitterMs) {
            throw new IllegalArgumentException("maxJitterMs must be >= minJitterMs");
        }
        this.minJitterMs = minJitterMs;
        this.maxJitterMs = maxJitterMs;
        this.fixedMs = fixedMs;
    }

    /**
     * Draws the next delay.
     *
     * @return delay in milliseconds
     */
    public long nextDelayMs() {
        long jitter = minJitterMs == maxJitterMs
                ? minJitterMs
                : ThreadLocalRandom.current().nextLong(minJitterMs, maxJitterMs + 1);
        return jitter + fixedMs;
    }

    public long minDelayMs() {
        return minJitterMs + fixedMs;
    }

    public long maxDelayMs() {
        return maxJitterMs + fixedMs;
    }

    @Override
    public String toString() {
        return "JitteredDelay{" + minJitterMs + ".." + maxJitterMs + "ms +" + fixedMs + "ms}";
    }
}
