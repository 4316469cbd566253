package publicador.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import publicador.dispatch.FailureKind;
import publicador.model.PublicationStatus;
import publicador.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code publicador.lock.contended}: dispatches that found the publication locked</li>
 *   <li>{@code publicador.post.published}: posts delivered</li>
 *   <li>{@code publicador.post.failed} (tag {@code kind}): posts that failed</li>
 *   <li>{@code publicador.gateway.retry}: gateway calls repeated after a retryable error</li>
 *   <li>{@code publicador.publication.finalized} (tag {@code status}): released publications</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code publicador.post.duration}: wall-clock time per post, retries included</li>
 * </ul>
 *
 * <p>Tagged counters are registered up front, one per enum value.
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter lockContended;
  private final Counter postPublished;
  private final Map<FailureKind, Counter> postFailed = new EnumMap<>(FailureKind.class);
  private final Counter gatewayRetry;
  private final Map<PublicationStatus, Counter> finalized = new EnumMap<>(PublicationStatus.class);
  private final Timer postDuration;
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "publicador"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "publicador");
  }

  /**
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "news.publicador"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.lockContended = Counter.builder(namePrefix + ".lock.contended")
        .description("Dispatches skipped because the publication was already locked")
        .register(registry);
    this.postPublished = Counter.builder(namePrefix + ".post.published")
        .description("Posts delivered successfully")
        .register(registry);
    for (FailureKind kind : FailureKind.values()) {
      postFailed.put(kind, Counter.builder(namePrefix + ".post.failed")
          .description("Posts that ended in failure")
          .tag("kind", kind.name())
          .register(registry));
    }
    this.gatewayRetry = Counter.builder(namePrefix + ".gateway.retry")
        .description("Gateway calls repeated after a retryable error")
        .register(registry);
    for (PublicationStatus status : PublicationStatus.values()) {
      if (status.isDispatchResult()) {
        finalized.put(status, Counter.builder(namePrefix + ".publication.finalized")
            .description("Publications released with a final status")
            .tag("status", status.name())
            .register(registry));
      }
    }
    this.postDuration = Timer.builder(namePrefix + ".post.duration")
        .description("Time spent on one post, retries included")
        .register(registry);
  }

  @Override
  public void incrementLockContended() {
    if (closed) return;
    lockContended.increment();
  }

  @Override
  public void incrementPostPublished() {
    if (closed) return;
    postPublished.increment();
  }

  @Override
  public void incrementPostFailed(FailureKind kind) {
    if (closed) return;
    postFailed.get(kind).increment();
  }

  @Override
  public void incrementGatewayRetry() {
    if (closed) return;
    gatewayRetry.increment();
  }

  @Override
  public void incrementPublicationFinalized(PublicationStatus status) {
    if (closed) return;
    Counter counter = finalized.get(status);
    if (counter != null) {
      counter.increment();
    }
  }

  @Override
  public void recordPostDurationMs(long durationMs) {
    if (closed) return;
    postDuration.record(durationMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(lockContended, postPublished, gatewayRetry, postDuration));
    meters.addAll(postFailed.values());
    meters.addAll(finalized.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
