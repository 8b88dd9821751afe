package jobsched.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import jobsched.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code jobsched.reload} - working-set reloads</li>
 *   <li>{@code jobsched.reload.failure} - reloads that failed</li>
 *   <li>{@code jobsched.claim.won} - claims won by this process</li>
 *   <li>{@code jobsched.claim.lost} - claims lost to another process</li>
 *   <li>{@code jobsched.claim.failure} - claims that errored</li>
 *   <li>{@code jobsched.emit} - occurrences emitted to listeners</li>
 *   <li>{@code jobsched.emit.suppressed} - occurrences withheld by channel filtering</li>
 *   <li>{@code jobsched.listener.failure} - listener invocations that threw</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code jobsched.working-set.size} - jobs currently held in the working set</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {
  public static final String DEFAULT_PREFIX = "jobsched";

  private final MeterRegistry registry;
  private final Counter reload;
  private final Counter reloadFailure;
  private final Counter claimWon;
  private final Counter claimLost;
  private final Counter claimFailure;
  private final Counter emitted;
  private final Counter emitSuppressed;
  private final Counter listenerFailure;
  private final Gauge workingSetGauge;

  private final AtomicInteger workingSetSize = new AtomicInteger();
  private volatile boolean closed;

  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, DEFAULT_PREFIX);
  }

  /**
   * Creates an exporter with a custom metric name prefix, for several schedulers in one
   * process.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "billing.jobsched"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty() || namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must be non-empty and not end with '.'");
    }

    this.registry = registry;
    this.reload = counter(namePrefix + ".reload", "Working set reloads");
    this.reloadFailure = counter(namePrefix + ".reload.failure", "Working set reloads that failed");
    this.claimWon = counter(namePrefix + ".claim.won", "Claims won by this scheduler");
    this.claimLost = counter(namePrefix + ".claim.lost", "Claims lost to another scheduler");
    this.claimFailure = counter(namePrefix + ".claim.failure", "Claims that failed with an error");
    this.emitted = counter(namePrefix + ".emit", "Occurrences emitted to listeners");
    this.emitSuppressed = counter(namePrefix + ".emit.suppressed", "Occurrences withheld by channel filtering");
    this.listenerFailure = counter(namePrefix + ".listener.failure", "Listener invocations that threw");
    this.workingSetGauge = Gauge.builder(namePrefix + ".working-set.size", workingSetSize, AtomicInteger::get)
        .description("Jobs held in the working set")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementReload() {
    if (closed) return;
    reload.increment();
  }

  @Override
  public void incrementReloadFailure() {
    if (closed) return;
    reloadFailure.increment();
  }

  @Override
  public void recordWorkingSetSize(int size) {
    if (closed) return;
    workingSetSize.set(size);
  }

  @Override
  public void incrementClaimWon() {
    if (closed) return;
    claimWon.increment();
  }

  @Override
  public void incrementClaimLost() {
    if (closed) return;
    claimLost.increment();
  }

  @Override
  public void incrementClaimFailure() {
    if (closed) return;
    claimFailure.increment();
  }

  @Override
  public void incrementEmitted() {
    if (closed) return;
    emitted.increment();
  }

  @Override
  public void incrementEmitSuppressed() {
    if (closed) return;
    emitSuppressed.increment();
  }

  @Override
  public void incrementListenerFailure() {
    if (closed) return;
    listenerFailure.increment();
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(reload, reloadFailure, claimWon, claimLost, claimFailure,
        emitted, emitSuppressed, listenerFailure, workingSetGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
