package hookrelay.history;

import hookrelay.InMemoryWebhookStore;
import hookrelay.model.DeliveryUpdate;
import hookrelay.model.NewDelivery;
import hookrelay.model.Webhook;
import hookrelay.spi.ConnectionProvider;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class DeliveryHistoryTest {

  @Test
  void pagesNewestFirst() throws Exception {
    InMemoryWebhookStore store = new InMemoryWebhookStore();
    Webhook hook = store.addWebhook("https://a.test", "whsec_a", "ticket.created");
    for (int attempt = 1; attempt <= 3; attempt++) {
      store.createDelivery(null, new NewDelivery(UUID.randomUUID(), hook.id(), "ticket.created", "{}", Map.of(), attempt));
    }
    DeliveryHistory history = new DeliveryHistory(InMemoryWebhookStore.stubCp(), store);

    assertEquals(3, history.forWebhook(hook.id(), 2, 0).get(0).attemptNumber());
    assertEquals(1, history.forWebhook(hook.id(), 2, 2).get(0).attemptNumber());
    assertTrue(history.forWebhook(hook.id() + 1, 10, 0).isEmpty());
    assertThrows(IllegalArgumentException.class, () -> history.forWebhook(hook.id(), 0, 0));
  }

  @Test
  void findsSingleDeliveryAndDueRetries() throws Exception {
    InMemoryWebhookStore store = new InMemoryWebhookStore();
    Webhook hook = store.addWebhook("https://a.test", "whsec_a", "ticket.created");
    long id = store.createDelivery(null,
        new NewDelivery(UUID.randomUUID(), hook.id(), "ticket.created", "{}", Map.of(), 1));
    store.updateDelivery(null, id, DeliveryUpdate.builder().nextRetryAt(Instant.now().minusSeconds(1)).build());
    DeliveryHistory history = new DeliveryHistory(InMemoryWebhookStore.stubCp(), store);

    assertTrue(history.find(id).isPresent());
    assertTrue(history.find(id + 99).isEmpty());
    assertEquals(1, history.pendingRetries(10).size());
  }

  @Test
  void connectionFailureYieldsEmptyResults() {
    ConnectionProvider broken = () -> {
      throw new SQLException("pool exhausted");
    };
    DeliveryHistory history = new DeliveryHistory(broken, new InMemoryWebhookStore());

    assertTrue(history.forWebhook(1, 10, 0).isEmpty());
    assertTrue(history.find(1).isEmpty());
    assertTrue(history.pendingRetries(10).isEmpty());
  }
}
