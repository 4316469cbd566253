package publicador.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Read-only view of a publication row, as loaded by the dispatch engine.
 *
 * <p>{@code processingStartedAt} is non-null exactly while a dispatch attempt holds the
 * publication lock.
 *
 * @see publicador.spi.PublicationStore#findPublication
 */
public record Publication(
    String id,
    String projectId,
    String createdBy,
    PublicationStatus status,
    String title,
    String description,
    String content,
    String tags,
    String language,
    Instant scheduledAt,
    Instant processingStartedAt,
    List<PublicationMedia> media
) {
  public Publication {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(status, "status");
    media = media == null ? List.of() : List.copyOf(media);
  }

  /**
   * @return {@code true} if there is non-blank text or at least one media file to send
   */
  public boolean hasContentOrMedia() {
    return (content != null && !content.isBlank()) || !media.isEmpty();
  }
}
