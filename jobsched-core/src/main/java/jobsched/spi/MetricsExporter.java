package jobsched.spi;

/**
 * Observability hook for exporting scheduler counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of working-set reloads from the store.
     */
    void incrementReload();

    /**
     * Increments the count of reloads that failed.
     */
    void incrementReloadFailure();

    /**
     * Records the number of jobs currently held in the working set.
     *
     * @param size working set size
     */
    void recordWorkingSetSize(int size);

    /**
     * Increments the count of claims this process won.
     */
    void incrementClaimWon();

    /**
     * Increments the count of claims lost to another process.
     */
    void incrementClaimLost();

    /**
     * Increments the count of claims that failed with an error.
     */
    void incrementClaimFailure();

    /**
     * Increments the count of occurrences emitted to listeners.
     */
    void incrementEmitted();

    /**
     * Increments the count of occurrences withheld because their channel is not emitting.
     */
    default void incrementEmitSuppressed() {
    }

    /**
     * Increments the count of listener invocations that threw.
     */
    default void incrementListenerFailure() {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementReload() {
        }

        @Override
        public void incrementReloadFailure() {
        }

        @Override
        public void recordWorkingSetSize(int size) {
        }

        @Override
        public void incrementClaimWon() {
        }

        @Override
        public void incrementClaimLost() {
        }

        @Override
        public void incrementClaimFailure() {
        }

        @Override
        public void incrementEmitted() {
        }
    }
}
