package hookrelay.delivery;

/**
 * What happened to one {@link DeliveryTask}.
 */
public enum DeliveryOutcome {
  /** Endpoint answered 2xx. */
  DELIVERED,
  /** Attempt failed; another attempt is scheduled. */
  RETRY_SCHEDULED,
  /** Attempt failed and it was the last one allowed. */
  EXHAUSTED,
  /** Nothing was sent: the payload could not be serialized or the delivery row not written. */
  ABANDONED
}
