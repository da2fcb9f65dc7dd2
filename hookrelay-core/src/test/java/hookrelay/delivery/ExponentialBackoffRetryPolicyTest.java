package hookrelay.delivery;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {

  @Test
  void delayStaysWithinBaseAndOneAndAHalfBase() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy();

    for (int attempt = 1; attempt <= 5; attempt++) {
      long base = 1000L << (attempt - 1);
      for (int i = 0; i < 200; i++) {
        long delay = policy.computeDelayMs(attempt);
        assertTrue(delay >= base && delay <= Math.min(base + base / 2, 3_600_000L),
            "attempt " + attempt + " gave " + delay);
      }
    }
  }

  @Test
  void baseDelayDoublesPerAttempt() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 100_000);

    assertEquals(100, policy.baseDelayMs(1));
    assertEquals(200, policy.baseDelayMs(2));
    assertEquals(400, policy.baseDelayMs(3));
  }

  @Test
  void delayIsCappedAtMaxDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(1000, 3_600_000);

    assertEquals(3_600_000, policy.baseDelayMs(20));
    assertEquals(3_600_000, policy.computeDelayMs(20));
    assertEquals(3_600_000, policy.computeDelayMs(200));
  }

  @Test
  void nonPositiveAttemptHasNoDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy();

    assertEquals(0, policy.computeDelayMs(0));
  }

  @Test
  void rejectsInvalidBounds() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(0, 1000));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(1000, 10));
  }
}
