package hookrelay;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.f4b6a3.ulid.Ulid;
import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.UUID;

/**
 * The envelope POSTed to every endpoint: {@code {id, event_type, timestamp, data}}.
 *
 * <p>One envelope is built per domain event and shared by every matching
 * webhook. It is persisted with the first delivery attempt and reused verbatim
 * by every retry, so {@code id} and {@code timestamp} identify the event, not
 * the attempt.
 *
 * @param id        time-ordered identifier, also sent as the delivery header
 * @param eventType dotted event type, e.g. {@code ticket.created}
 * @param timestamp creation time, rendered as RFC 3339 UTC
 * @param data      serialized domain event
 */
public record WebhookPayload(UUID id, String eventType, Instant timestamp, JsonNode data) {

  public WebhookPayload {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(data, "data");
  }

  /**
   * Creates a new envelope with a fresh monotonic id and the current time.
   *
   * @param eventType the event type
   * @param data      event body
   * @return the envelope
   */
  public static WebhookPayload create(String eventType, JsonNode data) {
    return new WebhookPayload(
        newId(),
        eventType,
        Instant.now().truncatedTo(ChronoUnit.MILLIS),
        data);
  }

  /**
   * A monotonic ULID stamped as UUID version 7. Both share the layout of a 48-bit
   * Unix millisecond timestamp followed by random bits.
   */
  static UUID newId() {
    Ulid ulid = UlidCreator.getMonotonicUlid();
    long msb = (ulid.getMostSignificantBits() & ~0xF000L) | 0x7000L;
    long lsb = (ulid.getLeastSignificantBits() & 0x3FFFFFFFFFFFFFFFL) | 0x8000000000000000L;
    return new UUID(msb, lsb);
  }
}
