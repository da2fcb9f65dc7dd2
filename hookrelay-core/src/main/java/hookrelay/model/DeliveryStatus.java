package hookrelay.model;

/**
 * State of a single delivery row, derived from its timestamps.
 *
 * <p>The status describes the row, not the chain it belongs to. Once the retry
 * scheduler picks a row up, its {@code next_retry_at} is cleared and the row
 * reads {@link #FAILED} while the next attempt lives in a new row with a higher
 * attempt number. Whether a chain ended is visible only from its newest row.
 */
public enum DeliveryStatus {
  /** Row written, attempt not finished yet. */
  PENDING,
  /** Endpoint answered 2xx. */
  DELIVERED,
  /** Attempt failed and another one is scheduled. */
  RETRY_SCHEDULED,
  /** Attempt failed and no retry is pending from this row. */
  FAILED
}
