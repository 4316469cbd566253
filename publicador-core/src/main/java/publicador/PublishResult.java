package publicador;

import publicador.dispatch.DispatchOutcome;
import publicador.model.PublicationStatus;

import java.util.List;
import java.util.Objects;

/**
 * Summary of one dispatch attempt.
 *
 * <p>When {@code acquired} is {@code false} nothing was sent and {@code outcomes} is empty:
 * either another attempt held the lock ({@code status} PROCESSING), or a scheduled dispatch
 * found the publication no longer SCHEDULED ({@code status} as last read).
 */
public record PublishResult(
    String publicationId,
    boolean acquired,
    PublicationStatus status,
    int publishedCount,
    int failedCount,
    List<DispatchOutcome> outcomes,
    String message
) {
  public PublishResult {
    Objects.requireNonNull(publicationId, "publicationId");
    Objects.requireNonNull(status, "status");
    outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
  }

  static PublishResult alreadyProcessing(String publicationId) {
    return new PublishResult(publicationId, false, PublicationStatus.PROCESSING, 0, 0, List.of(),
        "Publication is already being processed");
  }

  static PublishResult notScheduled(String publicationId, PublicationStatus lastKnown) {
    return new PublishResult(publicationId, false, lastKnown, 0, 0, List.of(),
        "Publication is no longer scheduled");
  }

  static PublishResult of(String publicationId, PublicationStatus status, List<DispatchOutcome> outcomes) {
    int published = (int) outcomes.stream().filter(DispatchOutcome::success).count();
    return new PublishResult(publicationId, true, status, published, outcomes.size() - published, outcomes,
        messageFor(status, outcomes));
  }

  private static String messageFor(PublicationStatus status, List<DispatchOutcome> outcomes) {
    if (outcomes.isEmpty()) {
      return "No posts to publish";
    }
    switch (status) {
      case PUBLISHED:
        return "Success";
      case PARTIAL:
        return "Partial success";
      default:
        return "All posts failed";
    }
  }

  public boolean success() {
    return acquired && !outcomes.isEmpty() && status == PublicationStatus.PUBLISHED;
  }
}
