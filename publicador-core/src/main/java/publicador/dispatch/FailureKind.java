package publicador.dispatch;

/**
 * Why a post did not get published.
 */
public enum FailureKind {
  /** Channel inactive, archived or missing usable credentials. Never retried. */
  VALIDATION,
  /** Gateway rejected the post (4xx or {@code success:false}). Never retried. */
  GATEWAY_TERMINAL,
  /** Retryable gateway errors until the attempt budget ran out. */
  RETRIES_EXHAUSTED,
  /** The per-post processing timeout elapsed. */
  TIMEOUT,
  /** Shutdown began before the post was attempted. */
  ABORTED,
  /** The post's scheduling window passed before it was sent. */
  EXPIRED,
  /** Unexpected error while preparing or sending the post. */
  INTERNAL
}
