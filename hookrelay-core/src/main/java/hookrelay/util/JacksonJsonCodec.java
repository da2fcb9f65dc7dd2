package hookrelay.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import hookrelay.WebhookPayload;
import hookrelay.event.DomainEvent;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * Jackson-backed {@link JsonCodec}.
 *
 * <p>Envelopes are written field by field so the wire order is always
 * {@code id, event_type, timestamp, data}, with the timestamp as an RFC 3339
 * UTC string.
 */
public final class JacksonJsonCodec implements JsonCodec {
  static final JacksonJsonCodec INSTANCE = new JacksonJsonCodec();

  private static final Logger logger = Logger.getLogger(JacksonJsonCodec.class.getName());

  private final ObjectMapper mapper;

  public JacksonJsonCodec() {
    this(new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
  }

  public JacksonJsonCodec(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  @Override
  public String toJson(Map<String, String> headers) {
    if (headers == null || headers.isEmpty()) {
      return null;
    }
    try {
      return mapper.writeValueAsString(headers);
    } catch (JsonProcessingException e) {
      throw new PayloadSerializationException("Failed to encode header map", e);
    }
  }

  @Override
  public Map<String, String> parseObject(String json) {
    if (json == null || json.isBlank()) {
      return Collections.emptyMap();
    }
    JsonNode node;
    try {
      node = mapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new PayloadSerializationException("Malformed JSON object", e);
    }
    if (node == null || node.isNull()) {
      return Collections.emptyMap();
    }
    if (!node.isObject()) {
      logger.warning("Expected a JSON object, got " + node.getNodeType() + "; ignoring it");
      return Collections.emptyMap();
    }
    Map<String, String> result = new LinkedHashMap<>();
    node.fields().forEachRemaining(field -> {
      if (field.getValue().isTextual()) {
        result.put(field.getKey(), field.getValue().textValue());
      } else {
        logger.warning("Skipping non-string value of " + field.getKey() + " (" + field.getValue().getNodeType() + ")");
      }
    });
    return Collections.unmodifiableMap(result);
  }

  @Override
  public JsonNode encodeEvent(DomainEvent event) {
    ObjectNode node = mapper.createObjectNode();
    node.put("type", event.kind().tag());
    try {
      for (Map.Entry<String, Object> attribute : event.attributes().entrySet()) {
        node.set(attribute.getKey(), mapper.valueToTree(attribute.getValue()));
      }
    } catch (IllegalArgumentException e) {
      throw new PayloadSerializationException("Failed to serialize " + event.kind().tag(), e);
    }
    return node;
  }

  @Override
  public byte[] encodePayload(WebhookPayload payload) {
    ObjectNode node = mapper.createObjectNode();
    node.put("id", payload.id().toString());
    node.put("event_type", payload.eventType());
    node.put("timestamp", payload.timestamp().toString());
    node.set("data", payload.data());
    try {
      return mapper.writeValueAsBytes(node);
    } catch (JsonProcessingException e) {
      throw new PayloadSerializationException("Failed to serialize payload " + payload.id(), e);
    }
  }

  @Override
  public WebhookPayload decodePayload(String json) {
    try {
      JsonNode node = mapper.readTree(json);
      if (node == null || !node.isObject()) {
        throw new PayloadSerializationException("Stored payload is not a JSON object", null);
      }
      return new WebhookPayload(
          UUID.fromString(requiredText(node, "id")),
          requiredText(node, "event_type"),
          Instant.parse(requiredText(node, "timestamp")),
          node.path("data").isMissingNode() ? mapper.nullNode() : node.get("data"));
    } catch (IOException | IllegalArgumentException | DateTimeParseException e) {
      throw new PayloadSerializationException("Failed to decode stored payload", e);
    }
  }

  private static String requiredText(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || !value.isTextual()) {
      throw new IllegalArgumentException("Missing field: " + field);
    }
    return value.asText();
  }
}
