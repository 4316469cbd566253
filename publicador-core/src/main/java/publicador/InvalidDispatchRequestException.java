package publicador;

/**
 * Thrown before any state change when a dispatch request cannot be served: unknown
 * publication or post, or a publication with nothing to send.
 */
public class InvalidDispatchRequestException extends RuntimeException {

  public InvalidDispatchRequestException(String message) {
    super(message);
  }
}
