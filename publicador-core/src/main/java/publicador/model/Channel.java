package publicador.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A configured delivery target. Read-only to the dispatch engine.
 *
 * <p>{@code credentials} is the parsed credentials blob; {@code null} means the stored
 * blob could not be read as a flat JSON object.
 */
public record Channel(
    String id,
    String projectId,
    SocialMedia socialMedia,
    String name,
    String channelIdentifier,
    String language,
    Map<String, String> credentials,
    Map<String, String> preferences,
    boolean active,
    Instant archivedAt,
    boolean projectArchived
) {
  public Channel {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(socialMedia, "socialMedia");
    credentials = credentials == null ? null : Map.copyOf(credentials);
    preferences = preferences == null ? Map.of() : Map.copyOf(preferences);
  }
}
