package hookrelay.model;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Insert request for a delivery row, written just before the HTTP call.
 *
 * @param uuid           external id of this row
 * @param webhookId      owning webhook
 * @param eventType      dotted event type
 * @param payloadJson    the envelope exactly as sent
 * @param requestHeaders headers as sent, with the signature value redacted
 * @param attemptNumber  1 for the first attempt of a chain
 */
public record NewDelivery(
    UUID uuid,
    long webhookId,
    String eventType,
    String payloadJson,
    Map<String, String> requestHeaders,
    int attemptNumber
) {

  public NewDelivery {
    Objects.requireNonNull(uuid, "uuid");
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(payloadJson, "payloadJson");
    requestHeaders = requestHeaders == null ? Map.of() : Map.copyOf(requestHeaders);
    if (attemptNumber < 1) {
      throw new IllegalArgumentException("attemptNumber must be >= 1");
    }
  }
}
