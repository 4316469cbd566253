package publicador.channel;

import publicador.model.Channel;

import java.util.Map;
import java.util.Objects;

/**
 * Target identifier and API key the posting service needs for one channel.
 *
 * <p>Telegram reads both values from the credentials blob and never falls back to the
 * channel identifier; VK and SITE post to the channel identifier.
 */
public record PlatformParams(String targetChannelId, String apiKey) {
  static final String TELEGRAM_BOT_TOKEN = "telegramBotToken";
  static final String TELEGRAM_CHANNEL_ID = "telegramChannelId";
  static final String VK_ACCESS_TOKEN = "vkAccessToken";
  static final String SITE_API_KEY = "apiKey";

  public PlatformParams {
    Objects.requireNonNull(targetChannelId, "targetChannelId");
    Objects.requireNonNull(apiKey, "apiKey");
  }

  /**
   * Resolves the parameters of a validated channel. Missing values resolve to empty strings.
   */
  public static PlatformParams resolve(Channel channel) {
    Map<String, String> credentials = channel.credentials() == null ? Map.of() : channel.credentials();
    return switch (channel.socialMedia()) {
      case TELEGRAM -> new PlatformParams(
          credentials.getOrDefault(TELEGRAM_CHANNEL_ID, ""),
          credentials.getOrDefault(TELEGRAM_BOT_TOKEN, ""));
      case VK -> new PlatformParams(
          nullToEmpty(channel.channelIdentifier()),
          credentials.getOrDefault(VK_ACCESS_TOKEN, ""));
      case SITE -> new PlatformParams(
          nullToEmpty(channel.channelIdentifier()),
          credentials.getOrDefault(SITE_API_KEY, ""));
    };
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
