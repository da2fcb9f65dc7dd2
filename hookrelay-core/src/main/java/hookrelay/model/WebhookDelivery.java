package hookrelay.model;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One delivery attempt as persisted in delivery history.
 *
 * <p>{@code responseStatus} is {@code 0} when no HTTP response was obtained and
 * {@code null} while the attempt is still in flight.
 *
 * @see hookrelay.spi.WebhookStore#findPendingRetries
 * @see hookrelay.spi.WebhookStore#findDeliveries
 */
public record WebhookDelivery(
    long id,
    UUID uuid,
    long webhookId,
    String eventType,
    String payloadJson,
    Map<String, String> requestHeaders,
    int attemptNumber,
    Integer responseStatus,
    String responseBody,
    Long durationMs,
    String errorMessage,
    Instant deliveredAt,
    Instant nextRetryAt,
    Instant createdAt
) {

  public WebhookDelivery {
    requestHeaders = requestHeaders == null ? Map.of() : Map.copyOf(requestHeaders);
  }

  public DeliveryStatus status() {
    if (deliveredAt != null) {
      return DeliveryStatus.DELIVERED;
    }
    if (nextRetryAt != null) {
      return DeliveryStatus.RETRY_SCHEDULED;
    }
    if (responseStatus == null && errorMessage == null) {
      return DeliveryStatus.PENDING;
    }
    return DeliveryStatus.FAILED;
  }
}
