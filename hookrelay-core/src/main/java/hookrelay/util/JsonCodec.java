package hookrelay.util;

import com.fasterxml.jackson.databind.JsonNode;
import hookrelay.WebhookPayload;
import hookrelay.event.DomainEvent;

import java.util.Map;

/**
 * JSON conversions used by the relay: envelopes on the wire and in delivery
 * history, domain event bodies, and the string maps stored for custom and
 * recorded request headers.
 *
 * <p>The default implementation ({@link JacksonJsonCodec}) is backed by a shared
 * Jackson {@code ObjectMapper}.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    /**
     * Returns the default singleton implementation.
     *
     * @return the default {@link JsonCodec}
     */
    static JsonCodec getDefault() {
        return JacksonJsonCodec.INSTANCE;
    }

    /**
     * Encodes a string map as a JSON object string. Returns {@code null} if the map is null or empty.
     *
     * @param headers the headers to encode
     * @return JSON string, or {@code null}
     */
    String toJson(Map<String, String> headers);

    /**
     * Parses a JSON object string into a string map. Returns an empty map for {@code null},
     * empty, {@code "null"} or non-object input. Members whose value is not a string are
     * skipped.
     *
     * @param json the JSON string to parse
     * @return parsed map (never {@code null})
     * @throws PayloadSerializationException if the input is not valid JSON
     */
    Map<String, String> parseObject(String json);

    /**
     * Serializes a domain event to its {@code {"type": ..., ...}} tree form.
     *
     * @param event the event
     * @return the JSON tree used as envelope {@code data}
     * @throws PayloadSerializationException if an attribute value cannot be serialized
     */
    JsonNode encodeEvent(DomainEvent event);

    /**
     * Serializes an envelope to its exact wire form. The bytes returned are the
     * bytes that get signed and sent.
     *
     * @param payload the envelope
     * @return UTF-8 JSON bytes
     * @throws PayloadSerializationException if the envelope cannot be serialized
     */
    byte[] encodePayload(WebhookPayload payload);

    /**
     * Parses an envelope persisted in delivery history.
     *
     * @param json the stored payload
     * @return the envelope
     * @throws PayloadSerializationException if the JSON is not a valid envelope
     */
    WebhookPayload decodePayload(String json);
}
