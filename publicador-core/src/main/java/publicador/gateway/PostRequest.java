package publicador.gateway;

import java.util.List;
import java.util.Objects;

/**
 * Outbound payload for one post, or for a channel preview.
 *
 * <p>{@code title}, {@code description} and {@code tags} are {@code null} for platforms
 * that receive them inside the formatted body. {@code idempotencyKey} is {@code null} for
 * previews.
 */
public record PostRequest(
    String platform,
    String channelIdentifier,
    String apiKey,
    String body,
    String bodyFormat,
    String idempotencyKey,
    String language,
    String title,
    String description,
    String tags,
    List<MediaRef> media
) {
  public static final String BODY_FORMAT_HTML = "html";

  public PostRequest {
    Objects.requireNonNull(platform, "platform");
    Objects.requireNonNull(channelIdentifier, "channelIdentifier");
    Objects.requireNonNull(apiKey, "apiKey");
    media = media == null ? List.of() : List.copyOf(media);
  }

  /**
   * Builds a body-only request used to check a channel without publishing anything.
   */
  public static PostRequest preview(String platform, String channelIdentifier, String apiKey, String body) {
    return new PostRequest(platform, channelIdentifier, apiKey, body, null, null, null,
        null, null, null, List.of());
  }
}
