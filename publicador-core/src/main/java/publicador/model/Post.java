package publicador.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Per-channel instance of a publication: one row per (publication, channel) pair.
 *
 * <p>{@code content} and {@code tags} override the publication's values for this channel
 * when non-null. {@code scheduledAt}, when set, replaces the publication's schedule for this
 * post.
 */
public record Post(
    String id,
    String publicationId,
    String channelId,
    PostStatus status,
    String content,
    String tags,
    Instant scheduledAt,
    Instant publishedAt,
    String errorMessage,
    Instant createdAt,
    Instant updatedAt
) {
  /** Error message the scheduler stores on a post whose window passed before it was sent. */
  public static final String EXPIRED_ERROR = "EXPIRED";

  public Post {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(publicationId, "publicationId");
    Objects.requireNonNull(channelId, "channelId");
    Objects.requireNonNull(status, "status");
  }

  public boolean isExpired() {
    return status == PostStatus.FAILED && EXPIRED_ERROR.equals(errorMessage);
  }
}
