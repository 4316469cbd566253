package publicador.dispatch;

import publicador.model.Post;

import java.time.Instant;
import java.util.Objects;

/**
 * In-memory result of attempting one post. Never persisted as its own row.
 *
 * <p>{@code skipped} marks a post that was not sent because of its stored state: already
 * PUBLISHED (counts as a success) or expired by the scheduler (counts as a failure).
 */
public record DispatchOutcome(
    String postId,
    String channelId,
    boolean success,
    boolean skipped,
    String url,
    Instant publishedAt,
    FailureKind failureKind,
    String errorMessage,
    int attempts
) {
  public DispatchOutcome {
    Objects.requireNonNull(postId, "postId");
    Objects.requireNonNull(channelId, "channelId");
    if (success == (failureKind != null)) {
      throw new IllegalArgumentException("failureKind must be set exactly when success is false");
    }
  }

  public static DispatchOutcome published(String postId, String channelId, String url,
      Instant publishedAt, int attempts) {
    return new DispatchOutcome(postId, channelId, true, false, url, publishedAt, null, null, attempts);
  }

  public static DispatchOutcome alreadyPublished(String postId, String channelId, Instant publishedAt) {
    return new DispatchOutcome(postId, channelId, true, true, null, publishedAt, null, null, 0);
  }

  public static DispatchOutcome expired(String postId, String channelId) {
    return new DispatchOutcome(postId, channelId, false, true, null, null, FailureKind.EXPIRED,
        Post.EXPIRED_ERROR, 0);
  }

  public static DispatchOutcome failed(String postId, String channelId, FailureKind kind,
      String errorMessage, int attempts) {
    Objects.requireNonNull(kind, "kind");
    return new DispatchOutcome(postId, channelId, false, false, null, null, kind, errorMessage, attempts);
  }
}
