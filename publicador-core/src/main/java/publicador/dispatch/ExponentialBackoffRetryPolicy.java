package publicador.dispatch;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter.
 *
 * <p>Delay formula: {@code baseDelay * 2^(failedCalls-1)}, capped at {@code maxDelay},
 * multiplied by a random factor in [0.5, 1.5) and capped again.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;

  /**
   * @param baseDelayMs delay before the first repeat (milliseconds)
   * @param maxDelayMs  upper bound for any single delay (milliseconds)
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
  }

  @Override
  public long computeDelayMs(int failedCalls) {
    if (failedCalls <= 0) {
      return 0L;
    }
    long expDelay;
    if (failedCalls >= 63) {
      expDelay = maxDelayMs;
    } else {
      long factor = 1L << (failedCalls - 1);
      expDelay = factor > maxDelayMs / baseDelayMs ? maxDelayMs : baseDelayMs * factor;
    }
    long capped = Math.min(maxDelayMs, expDelay);
    double jitter = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
    return Math.min(maxDelayMs, Math.max(0L, (long) (capped * jitter)));
  }
}
