package hookrelay;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class WebhookPayloadTest {

  @Test
  void idsAreVersionSevenUuids() {
    UUID id = WebhookPayload.create("ticket.created", JsonNodeFactory.instance.objectNode()).id();

    assertEquals(7, id.version());
    assertEquals(2, id.variant());
    assertEquals(id, UUID.fromString(id.toString()));
  }

  @Test
  void idsCarryCreationMillisAndSortInCreationOrder() {
    long before = Instant.now().toEpochMilli();
    List<UUID> ids = new ArrayList<>();
    for (int i = 0; i < 1000; i++) {
      ids.add(WebhookPayload.newId());
    }
    long after = Instant.now().toEpochMilli();

    long millis = ids.get(0).getMostSignificantBits() >>> 16;
    assertTrue(millis >= before && millis <= after, "embedded time " + millis);
    for (int i = 1; i < ids.size(); i++) {
      assertTrue(ids.get(i - 1).toString().compareTo(ids.get(i).toString()) < 0, "out of order at " + i);
    }
  }

  @Test
  void timestampIsTruncatedToMillis() {
    WebhookPayload payload = WebhookPayload.create("comment.added", JsonNodeFactory.instance.objectNode());

    assertEquals(0, payload.timestamp().getNano() % 1_000_000);
  }
}
