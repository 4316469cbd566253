package publicador.spi;

import publicador.dispatch.FailureKind;
import publicador.model.PublicationStatus;

/**
 * Observability hook for exporting dispatch counters and timers to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 *
 * @see publicador.micrometer.MicrometerMetricsExporter
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of dispatch attempts that found the publication already locked.
   */
  void incrementLockContended();

  /**
   * Increments the count of posts delivered successfully.
   */
  void incrementPostPublished();

  /**
   * Increments the count of posts that ended in failure.
   *
   * @param kind why the post failed
   */
  void incrementPostFailed(FailureKind kind);

  /**
   * Increments the count of gateway calls repeated after a retryable error.
   */
  void incrementGatewayRetry();

  /**
   * Increments the count of publications released with the given final status.
   */
  void incrementPublicationFinalized(PublicationStatus status);

  /**
   * Records the wall-clock time spent on one post, validation and retries included.
   *
   * @param durationMs duration in milliseconds (always non-negative)
   */
  default void recordPostDurationMs(long durationMs) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementLockContended() {
    }

    @Override
    public void incrementPostPublished() {
    }

    @Override
    public void incrementPostFailed(FailureKind kind) {
    }

    @Override
    public void incrementGatewayRetry() {
    }

    @Override
    public void incrementPublicationFinalized(PublicationStatus status) {
    }
  }
}
