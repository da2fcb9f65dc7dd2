package hookrelay.model;

import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * A registered endpoint, as read from the store.
 *
 * <p>{@code failureCount} counts consecutive failed attempts across delivery chains
 * and resets to zero on the first success. {@code enabled} turns false once the
 * count reaches the auto-disable threshold and stays false until re-enabled
 * externally.
 */
public record Webhook(
    long id,
    UUID uuid,
    String name,
    String url,
    String secret,
    Set<String> events,
    Map<String, String> headers,
    boolean enabled,
    int failureCount,
    String disabledReason,
    Instant lastTriggeredAt,
    Instant createdAt
) {

  public Webhook {
    events = events == null ? Set.of() : Set.copyOf(events);
    headers = headers == null ? Map.of() : Map.copyOf(headers);
  }

  public boolean subscribesTo(String eventType) {
    return events.contains(eventType);
  }
}
