package hookrelay.delivery;

import hookrelay.WebhookPayload;
import hookrelay.model.Webhook;

import java.util.Map;
import java.util.Objects;

/**
 * One delivery attempt waiting in the {@link DeliveryQueue}.
 *
 * <p>The endpoint fields are copied from the webhook when the task is created, so
 * a task carries everything the worker needs to send without a lookup.
 *
 * @param webhookId target webhook
 * @param url       endpoint URL
 * @param secret    signing secret
 * @param headers   custom headers configured on the webhook
 * @param payload   the envelope to send
 * @param attempt   1-based attempt number within the delivery chain
 */
public record DeliveryTask(
    long webhookId,
    String url,
    String secret,
    Map<String, String> headers,
    WebhookPayload payload,
    int attempt
) {

  public DeliveryTask {
    Objects.requireNonNull(url, "url");
    Objects.requireNonNull(secret, "secret");
    Objects.requireNonNull(payload, "payload");
    headers = headers == null ? Map.of() : Map.copyOf(headers);
    if (attempt < 1) {
      throw new IllegalArgumentException("attempt must be >= 1");
    }
  }

  /**
   * Builds a task targeting {@code webhook}.
   *
   * @param webhook the target
   * @param payload the envelope
   * @param attempt attempt number
   * @return the task
   */
  public static DeliveryTask of(Webhook webhook, WebhookPayload payload, int attempt) {
    return new DeliveryTask(webhook.id(), webhook.url(), webhook.secret(), webhook.headers(), payload, attempt);
  }
}
