package publicador.format;

import publicador.channel.PlatformParams;
import publicador.gateway.MediaRef;
import publicador.gateway.PostRequest;
import publicador.model.Channel;
import publicador.model.Post;
import publicador.model.Publication;
import publicador.model.PublicationMedia;
import publicador.model.SocialMedia;
import publicador.model.StorageType;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Builds the outbound {@link PostRequest} for one post of a publication.
 *
 * <p>The post's own content and tags override the publication's. Telegram receives title,
 * description and tags only inside the rendered body; the other platforms get them as
 * separate fields as well.
 */
public final class PostRequestFactory {
  private final BodyFormatter bodyFormatter;
  private final String mediaBaseUrl;

  /**
   * @param bodyFormatter body renderer
   * @param mediaBaseUrl  base URL of the media storage, used for media that are neither
   *                      absolute URLs nor Telegram file ids; may be {@code null}
   */
  public PostRequestFactory(BodyFormatter bodyFormatter, String mediaBaseUrl) {
    this.bodyFormatter = Objects.requireNonNull(bodyFormatter, "bodyFormatter");
    this.mediaBaseUrl = stripTrailingSlash(mediaBaseUrl);
  }

  public PostRequest create(Publication publication, Post post, Channel channel, PlatformParams params) {
    String content = post.content() != null ? post.content() : publication.content();
    String tags = post.tags() != null ? post.tags() : publication.tags();
    String language = channel.language() != null ? channel.language() : publication.language();
    String body = bodyFormatter.format(
        new BodyContent(publication.title(), content, publication.description(), tags, language),
        channel.preferences());

    boolean telegram = channel.socialMedia() == SocialMedia.TELEGRAM;
    String formattedTags = TagsFormatter.format(tags);
    return new PostRequest(
        channel.socialMedia().platformName(),
        params.targetChannelId(),
        params.apiKey(),
        body,
        PostRequest.BODY_FORMAT_HTML,
        idempotencyKey(post),
        language,
        telegram ? null : publication.title(),
        telegram ? null : publication.description(),
        telegram || formattedTags.isEmpty() ? null : formattedTags,
        mapMedia(publication.media()));
  }

  /**
   * {@code post-{postId}-{updatedAt millis}}: stable for retries of the same edit, new after
   * the post changes.
   */
  static String idempotencyKey(Post post) {
    Instant version = post.updatedAt() != null ? post.updatedAt() : post.createdAt();
    return "post-" + post.id() + "-" + (version == null ? 0L : version.toEpochMilli());
  }

  private List<MediaRef> mapMedia(List<PublicationMedia> media) {
    return media.stream()
        .sorted(Comparator.comparingInt(PublicationMedia::order))
        .map(m -> new MediaRef(mediaSrc(m), m.type().wireName(), m.hasSpoiler()))
        .toList();
  }

  String mediaSrc(PublicationMedia media) {
    String path = media.storagePath();
    if (path.startsWith("http://") || path.startsWith("https://")) {
      return path;
    }
    if (media.storageType() == StorageType.TELEGRAM || mediaBaseUrl == null) {
      return path;
    }
    return mediaBaseUrl + "/files/" + (path.startsWith("/") ? path.substring(1) : path) + "/download";
  }

  private static String stripTrailingSlash(String url) {
    if (url == null || url.isBlank()) {
      return null;
    }
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
