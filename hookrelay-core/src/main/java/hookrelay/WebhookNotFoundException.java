package hookrelay;

/**
 * Thrown when an operation names a webhook id that does not exist.
 */
public class WebhookNotFoundException extends RuntimeException {
  private final long webhookId;

  public WebhookNotFoundException(long webhookId) {
    super("Webhook not found: " + webhookId);
    this.webhookId = webhookId;
  }

  public long webhookId() {
    return webhookId;
  }
}
