package publicador.gateway;

import java.util.Objects;

/**
 * Media reference in an outbound post: a resolvable {@code src}, the wire media type and
 * the spoiler flag.
 */
public record MediaRef(String src, String type, boolean hasSpoiler) {
  public MediaRef {
    Objects.requireNonNull(src, "src");
    Objects.requireNonNull(type, "type");
  }
}
