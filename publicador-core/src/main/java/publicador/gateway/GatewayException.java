package publicador.gateway;

/**
 * Failure reported by a {@link PostingGateway} call.
 *
 * <p>The {@link Kind} decides whether the dispatcher may try again: {@link Kind#RETRYABLE}
 * and {@link Kind#TIMEOUT} count toward the retry budget, {@link Kind#TERMINAL} ends the
 * post immediately.
 */
public class GatewayException extends Exception {

  public enum Kind {
    /** 4xx response, or a 2xx response that reports {@code success:false}. */
    TERMINAL,
    /** 5xx response or a transport-level failure. */
    RETRYABLE,
    /** No response within the per-call timeout. */
    TIMEOUT
  }

  private final Kind kind;
  private final int statusCode;

  public GatewayException(Kind kind, String message) {
    this(kind, 0, message, null);
  }

  public GatewayException(Kind kind, int statusCode, String message) {
    this(kind, statusCode, message, null);
  }

  public GatewayException(Kind kind, int statusCode, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.statusCode = statusCode;
  }

  public Kind kind() {
    return kind;
  }

  /**
   * @return the HTTP status code, or {@code 0} when no response was received
   */
  public int statusCode() {
    return statusCode;
  }

  public boolean isRetryable() {
    return kind != Kind.TERMINAL;
  }
}
