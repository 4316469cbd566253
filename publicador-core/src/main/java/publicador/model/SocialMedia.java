package publicador.model;

import java.util.Locale;

/**
 * Social network kinds a channel can deliver to.
 */
public enum SocialMedia {
  TELEGRAM,
  VK,
  SITE;

  /**
   * Platform name as the posting gateway expects it ({@code telegram}, {@code vk}, {@code site}).
   */
  public String platformName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
