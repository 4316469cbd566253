package publicador.model;

import java.util.Objects;

/**
 * Media file attached to a publication, in display order.
 */
public record PublicationMedia(
    String mediaId,
    MediaType type,
    StorageType storageType,
    String storagePath,
    int order,
    boolean hasSpoiler
) {
  public PublicationMedia {
    Objects.requireNonNull(mediaId, "mediaId");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(storageType, "storageType");
    Objects.requireNonNull(storagePath, "storagePath");
  }
}
