package publicador.channel;

import publicador.model.Channel;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks that a channel can be dispatched to: it exists, is active, is not archived, and
 * carries credentials shaped the way its platform expects.
 *
 * <p>All checks run; every failing one contributes a reason. The validator performs no I/O.
 */
public final class ChannelValidator {
  static final int MIN_TELEGRAM_TOKEN_LENGTH = 20;

  /**
   * @param channel the channel to check; {@code null} means the channel was not found
   */
  public ValidationResult validate(Channel channel) {
    if (channel == null) {
      return ValidationResult.invalid(List.of("Channel not found"));
    }
    List<String> errors = new ArrayList<>();
    if (!channel.active()) {
      errors.add("Channel is not active");
    }
    if (channel.archivedAt() != null) {
      errors.add("Channel is archived");
    }
    if (channel.projectArchived()) {
      errors.add("Project is archived");
    }
    if (isBlank(channel.channelIdentifier())) {
      errors.add("Channel identifier is missing");
    }
    if (channel.credentials() == null) {
      errors.add("Invalid credentials format");
    } else {
      checkCredentials(channel, channel.credentials(), errors);
    }
    return errors.isEmpty() ? ValidationResult.valid() : ValidationResult.invalid(errors);
  }

  private static void checkCredentials(Channel channel, Map<String, String> credentials, List<String> errors) {
    switch (channel.socialMedia()) {
      case TELEGRAM -> {
        String token = credentials.get(PlatformParams.TELEGRAM_BOT_TOKEN);
        if (isBlank(token)) {
          errors.add("Telegram credentials must include " + PlatformParams.TELEGRAM_BOT_TOKEN);
        } else {
          if (!token.contains(":")) {
            errors.add(PlatformParams.TELEGRAM_BOT_TOKEN + " must be in format \"bot_id:token\"");
          }
          if (token.length() < MIN_TELEGRAM_TOKEN_LENGTH) {
            errors.add(PlatformParams.TELEGRAM_BOT_TOKEN + " appears to be too short");
          }
        }
        if (isBlank(credentials.get(PlatformParams.TELEGRAM_CHANNEL_ID))) {
          errors.add("Telegram credentials must include " + PlatformParams.TELEGRAM_CHANNEL_ID);
        }
      }
      case VK -> {
        if (isBlank(credentials.get(PlatformParams.VK_ACCESS_TOKEN))) {
          errors.add("VK credentials must include " + PlatformParams.VK_ACCESS_TOKEN);
        }
      }
      case SITE -> {
        if (isBlank(credentials.get(PlatformParams.SITE_API_KEY))) {
          errors.add("Site credentials must include " + PlatformParams.SITE_API_KEY);
        }
      }
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
