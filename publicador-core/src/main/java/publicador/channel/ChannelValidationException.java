package publicador.channel;

/**
 * Thrown by {@link ChannelTester#testChannel} when the channel does not exist.
 */
public class ChannelValidationException extends RuntimeException {

  public ChannelValidationException(String message) {
    super(message);
  }
}
