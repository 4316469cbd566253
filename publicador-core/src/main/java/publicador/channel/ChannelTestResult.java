package publicador.channel;

/**
 * Result of a standalone channel check. {@code details} holds the platform's own message
 * when it rejected the preview, otherwise {@code null}.
 */
public record ChannelTestResult(boolean success, String message, String details) {

  static ChannelTestResult ok(String message) {
    return new ChannelTestResult(true, message, null);
  }

  static ChannelTestResult failed(String message) {
    return new ChannelTestResult(false, message, null);
  }
}
