package hookrelay.util;

/**
 * Thrown when an envelope, domain event, or header map cannot be converted to
 * or from JSON. Deliveries that hit this are never retried.
 */
public class PayloadSerializationException extends RuntimeException {

  public PayloadSerializationException(String message, Throwable cause) {
    super(message, cause);
  }
}
