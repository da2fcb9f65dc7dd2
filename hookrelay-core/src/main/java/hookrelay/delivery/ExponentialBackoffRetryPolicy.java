package hookrelay.delivery;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy using exponential backoff with additive jitter.
 *
 * <p>Delay formula: {@code base = initialDelay * 2^(attempt-1)}, plus a uniform
 * jitter in {@code [0, base/2]}, capped at {@code maxDelay}. Jitter is only ever
 * added, so a retry never fires earlier than {@code base}.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  public static final long DEFAULT_INITIAL_DELAY_MS = 1_000;
  public static final long DEFAULT_MAX_DELAY_MS = 3_600_000;

  private final long initialDelayMs;
  private final long maxDelayMs;

  public ExponentialBackoffRetryPolicy() {
    this(DEFAULT_INITIAL_DELAY_MS, DEFAULT_MAX_DELAY_MS);
  }

  /**
   * @param initialDelayMs delay before the second attempt, before jitter (milliseconds)
   * @param maxDelayMs     maximum delay cap (milliseconds)
   */
  public ExponentialBackoffRetryPolicy(long initialDelayMs, long maxDelayMs) {
    if (initialDelayMs <= 0) {
      throw new IllegalArgumentException("initialDelayMs must be > 0, got: " + initialDelayMs);
    }
    if (maxDelayMs < initialDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= initialDelayMs, got: " + maxDelayMs);
    }
    this.initialDelayMs = initialDelayMs;
    this.maxDelayMs = maxDelayMs;
  }

  /**
   * Un-jittered delay for {@code attempt}, capped at the maximum.
   *
   * @param attempt 1-based attempt number
   * @return base delay in milliseconds
   */
  public long baseDelayMs(int attempt) {
    if (attempt <= 0) {
      return 0L;
    }
    if (attempt >= 63) {
      return maxDelayMs;
    }
    long shift = 1L << (attempt - 1);
    // Overflow guard: anything past maxDelay is capped anyway
    if (shift > maxDelayMs / initialDelayMs) {
      return maxDelayMs;
    }
    return initialDelayMs * shift;
  }

  @Override
  public long computeDelayMs(int attempt) {
    long base = baseDelayMs(attempt);
    if (base == 0L) {
      return 0L;
    }
    long jitter = ThreadLocalRandom.current().nextLong(base / 2 + 1);
    return Math.min(maxDelayMs, base + jitter);
  }
}
