package publicador.dispatch;

/**
 * Strategy for computing the pause before repeating a failed gateway call.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

  /**
   * Computes the delay in milliseconds before the next call.
   *
   * @param failedCalls the number of calls that have failed so far (1-based)
   * @return delay in milliseconds (non-negative)
   */
  long computeDelayMs(int failedCalls);
}
