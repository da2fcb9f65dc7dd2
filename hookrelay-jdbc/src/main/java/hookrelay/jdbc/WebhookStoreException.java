package hookrelay.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by {@link hookrelay.jdbc.store.AbstractJdbcWebhookStore}
 * and its subclasses.
 */
public final class WebhookStoreException extends RuntimeException {

  public WebhookStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
