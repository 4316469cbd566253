package publicador.dispatch;

import publicador.lock.PublicationLock;
import publicador.model.Post;
import publicador.model.PostStatus;
import publicador.model.Publication;
import publicador.model.PublicationStatus;
import publicador.spi.MetricsExporter;
import publicador.spi.NotificationKind;
import publicador.spi.Notifier;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reduces per-post outcomes to one publication status, releases the publication lock with
 * it and alerts the author when the publication did not fully succeed.
 *
 * <p>PUBLISHED when every outcome succeeded (which includes having no posts at all), FAILED
 * when none did, PARTIAL otherwise.
 */
public final class ResultAggregator {
  private static final Logger logger = Logger.getLogger(ResultAggregator.class.getName());

  private final PublicationLock lock;
  private final Notifier notifier;
  private final MetricsExporter metrics;

  public ResultAggregator(PublicationLock lock, Notifier notifier, MetricsExporter metrics) {
    this.lock = Objects.requireNonNull(lock, "lock");
    this.notifier = notifier != null ? notifier : Notifier.NOOP;
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  public static PublicationStatus aggregate(List<DispatchOutcome> outcomes) {
    long succeeded = outcomes.stream().filter(DispatchOutcome::success).count();
    return statusFor(succeeded, outcomes.size());
  }

  /**
   * Status derived from what is stored: PUBLISHED posts are successes, anything else is not.
   */
  public static PublicationStatus aggregatePersisted(List<Post> posts) {
    long succeeded = posts.stream().filter(p -> p.status() == PostStatus.PUBLISHED).count();
    return statusFor(succeeded, posts.size());
  }

  private static PublicationStatus statusFor(long succeeded, long total) {
    if (succeeded == total) {
      return PublicationStatus.PUBLISHED;
    }
    return succeeded == 0 ? PublicationStatus.FAILED : PublicationStatus.PARTIAL;
  }

  /**
   * Aggregates {@code outcomes} and completes the publication with the result.
   */
  public PublicationStatus finalize(Publication publication, List<DispatchOutcome> outcomes) {
    PublicationStatus status = aggregate(outcomes);
    List<String> failedChannelIds = outcomes.stream()
        .filter(o -> !o.success())
        .map(DispatchOutcome::channelId)
        .toList();
    complete(publication, status, failedChannelIds);
    return status;
  }

  /**
   * Releases the lock with {@code status}, then notifies for PARTIAL and FAILED.
   *
   * @throws publicador.PublicationStoreException if the release cannot be written
   */
  public void complete(Publication publication, PublicationStatus status, List<String> failedChannelIds) {
    lock.release(publication.id(), status);
    metrics.incrementPublicationFinalized(status);
    logger.info("Publication " + publication.id() + " finished with status " + status);

    if (status == PublicationStatus.PUBLISHED) {
      return;
    }
    NotificationKind kind = status == PublicationStatus.PARTIAL
        ? NotificationKind.PUBLICATION_PARTIAL : NotificationKind.PUBLICATION_FAILED;
    Map<String, Object> context = new LinkedHashMap<>();
    context.put("publicationId", publication.id());
    context.put("projectId", publication.projectId());
    context.put("status", status.name());
    context.put("failedChannelIds", List.copyOf(failedChannelIds));
    try {
      notifier.notify(publication.createdBy(), kind, context);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Notifier failed for publication " + publication.id(), e);
    }
  }
}
