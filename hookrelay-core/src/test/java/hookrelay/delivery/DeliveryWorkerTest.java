package hookrelay.delivery;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import hookrelay.InMemoryWebhookStore;
import hookrelay.RecordingTransport;
import hookrelay.WebhookPayload;
import hookrelay.model.DeliveryStatus;
import hookrelay.model.Webhook;
import hookrelay.model.WebhookDelivery;
import hookrelay.signature.WebhookSignatures;
import hookrelay.util.JsonCodec;
import hookrelay.util.PayloadSerializationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.InterruptedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DeliveryWorkerTest {
  private InMemoryWebhookStore store;
  private DeliveryQueue queue;
  private Webhook webhook;

  @BeforeEach
  void setUp() {
    store = new InMemoryWebhookStore();
    queue = new DeliveryQueue();
    webhook = store.addWebhook("https://example.test/hook", "whsec_secret", "ticket.created");
  }

  private DeliveryWorker worker(WebhookTransport transport) {
    return DeliveryWorker.builder()
        .connectionProvider(InMemoryWebhookStore.stubCp())
        .store(store)
        .queue(queue)
        .transport(transport)
        .retryPolicy(attempt -> 60_000)
        .build();
  }

  private DeliveryTask task(int attempt) {
    WebhookPayload payload = WebhookPayload.create("ticket.created",
        JsonNodeFactory.instance.objectNode().put("type", "TicketCreated"));
    return DeliveryTask.of(store.webhook(webhook.id()), payload, attempt);
  }

  // ── Builder validation ──────────────────────────────────────────

  @Test
  void builderRequiresCollaborators() {
    assertThrows(NullPointerException.class, () -> DeliveryWorker.builder().store(store).queue(queue).build());
    assertThrows(NullPointerException.class, () -> DeliveryWorker.builder()
        .connectionProvider(InMemoryWebhookStore.stubCp()).queue(queue).build());
  }

  @Test
  void builderRejectsBadSettings() {
    assertThrows(IllegalArgumentException.class, () -> DeliveryWorker.builder()
        .connectionProvider(InMemoryWebhookStore.stubCp()).store(store).queue(queue).maxAttempts(0).build());
    assertThrows(IllegalArgumentException.class, () -> DeliveryWorker.builder()
        .connectionProvider(InMemoryWebhookStore.stubCp()).store(store).queue(queue)
        .requestTimeout(Duration.ZERO).build());
    assertThrows(IllegalArgumentException.class, () -> DeliveryWorker.builder()
        .connectionProvider(InMemoryWebhookStore.stubCp()).store(store).queue(queue)
        .productName("Bad Name").build());
  }

  // ── Request shape ───────────────────────────────────────────────

  @Test
  void sendsSignedRequestWithRelayHeaders() {
    RecordingTransport transport = new RecordingTransport(200);
    DeliveryTask task = task(1);

    worker(transport).deliver(task);

    RecordingTransport.Request request = transport.requests.get(0);
    assertEquals("https://example.test/hook", request.url());
    assertEquals("application/json", request.headers().get("Content-Type"));
    assertEquals("ticket.created", request.headers().get("X-Hookrelay-Event"));
    assertEquals(task.payload().id().toString(), request.headers().get("X-Hookrelay-Delivery"));
    assertEquals("Hookrelay-Webhook/1.0", request.headers().get("User-Agent"));
    String signature = request.headers().get("X-Hookrelay-Signature");
    assertTrue(WebhookSignatures.verify(request.body(), "whsec_secret", signature));
    assertArrayEquals(JsonCodec.getDefault().encodePayload(task.payload()), request.body());
  }

  @Test
  void customHeadersCannotOverrideReservedOnes() {
    Map<String, String> custom = new LinkedHashMap<>();
    custom.put("X-Team", "ops");
    custom.put("host", "evil.test");
    custom.put("AUTHORIZATION", "Bearer leaked");
    custom.put("user-agent", "spoof");
    custom.put("x-hookrelay-signature", "sha256=forged");
    Webhook withHeaders = store.addWebhook("https://example.test/h2", "whsec_2", custom, "ticket.created");
    RecordingTransport transport = new RecordingTransport(200);

    worker(transport).deliver(DeliveryTask.of(withHeaders,
        WebhookPayload.create("ticket.created", JsonNodeFactory.instance.objectNode()), 1));

    Map<String, String> sent = transport.requests.get(0).headers();
    assertEquals("ops", sent.get("X-Team"));
    assertFalse(sent.containsKey("host"));
    assertFalse(sent.containsKey("AUTHORIZATION"));
    assertFalse(sent.containsKey("user-agent"));
    assertEquals("Hookrelay-Webhook/1.0", sent.get("User-Agent"));
    assertNotEquals("sha256=forged", sent.get("X-Hookrelay-Signature"));
  }

  @Test
  void productNameShapesHeaderNames() {
    RecordingTransport transport = new RecordingTransport(204);
    DeliveryWorker worker = DeliveryWorker.builder()
        .connectionProvider(InMemoryWebhookStore.stubCp())
        .store(store)
        .queue(queue)
        .transport(transport)
        .productName("Nosdesk")
        .build();

    worker.deliver(task(1));

    Map<String, String> sent = transport.requests.get(0).headers();
    assertTrue(sent.containsKey("X-Nosdesk-Signature"));
    assertEquals("Nosdesk-Webhook/1.0", sent.get("User-Agent"));
  }

  // ── Outcomes ────────────────────────────────────────────────────

  @Test
  void successRecordsDeliveryAndResetsFailureStreak() {
    store.incrementFailureCount(null, webhook.id(), 10);
    store.incrementFailureCount(null, webhook.id(), 10);

    DeliveryOutcome outcome = worker(new RecordingTransport(201)).deliver(task(1));

    assertEquals(DeliveryOutcome.DELIVERED, outcome);
    WebhookDelivery row = store.deliveries().get(0);
    assertEquals(DeliveryStatus.DELIVERED, row.status());
    assertEquals(201, row.responseStatus());
    assertNotNull(row.deliveredAt());
    assertNull(row.nextRetryAt());
    assertNotNull(row.durationMs());
    assertEquals(1, row.attemptNumber());
    Webhook after = store.webhook(webhook.id());
    assertEquals(0, after.failureCount());
    assertNotNull(after.lastTriggeredAt());
  }

  @Test
  void deliveryRowStoresRedactedHeadersAndExactPayload() {
    DeliveryTask task = task(1);

    worker(new RecordingTransport(200)).deliver(task);

    WebhookDelivery row = store.deliveries().get(0);
    assertEquals("sha256=***", row.requestHeaders().get("X-Hookrelay-Signature"));
    assertEquals(task.payload().id().toString(), row.requestHeaders().get("X-Hookrelay-Delivery"));
    assertEquals(3, row.requestHeaders().size());
    assertEquals(task.payload(), JsonCodec.getDefault().decodePayload(row.payloadJson()));
  }

  @Test
  void httpErrorSchedulesRetryAndCountsFailure() {
    Instant before = Instant.now();

    DeliveryOutcome outcome = worker(new RecordingTransport(500)).deliver(task(1));

    assertEquals(DeliveryOutcome.RETRY_SCHEDULED, outcome);
    WebhookDelivery row = store.deliveries().get(0);
    assertEquals(500, row.responseStatus());
    assertEquals("status 500", row.responseBody());
    assertNull(row.deliveredAt());
    assertNotNull(row.nextRetryAt());
    assertFalse(row.nextRetryAt().isBefore(before.plusMillis(60_000)));
    assertEquals(1, store.webhook(webhook.id()).failureCount());
  }

  @Test
  void transportErrorRecordsStatusZeroAndMessage() {
    DeliveryOutcome outcome = worker(new RecordingTransport(-1)).deliver(task(2));

    assertEquals(DeliveryOutcome.RETRY_SCHEDULED, outcome);
    WebhookDelivery row = store.deliveries().get(0);
    assertEquals(0, row.responseStatus());
    assertEquals("Connection refused", row.errorMessage());
    assertEquals(2, row.attemptNumber());
  }

  @Test
  void callTimeoutIsRecordedAsTimeout() {
    DeliveryOutcome outcome = worker((url, headers, body, timeout) -> {
      throw new InterruptedIOException("timeout");
    }).deliver(task(1));

    assertEquals(DeliveryOutcome.RETRY_SCHEDULED, outcome);
    WebhookDelivery row = store.deliveries().get(0);
    assertEquals(0, row.responseStatus());
    assertEquals("Request timed out after 30s", row.errorMessage());
  }

  @Test
  void lastAttemptEndsChainWithoutRetry() {
    DeliveryOutcome outcome = worker(new RecordingTransport(503)).deliver(task(5));

    assertEquals(DeliveryOutcome.EXHAUSTED, outcome);
    WebhookDelivery row = store.deliveries().get(0);
    assertNull(row.deliveredAt());
    assertNull(row.nextRetryAt());
    assertEquals(DeliveryStatus.FAILED, row.status());
  }

  @Test
  void redirectIsAFailure() {
    assertEquals(DeliveryOutcome.RETRY_SCHEDULED, worker(new RecordingTransport(302)).deliver(task(1)));
  }

  @Test
  void tenthConsecutiveFailureDisablesWebhook() {
    DeliveryWorker worker = worker(new RecordingTransport(500));

    for (int i = 1; i <= 9; i++) {
      worker.deliver(task(1 + (i - 1) % 5));
      assertTrue(store.webhook(webhook.id()).enabled(), "disabled early at failure " + i);
    }
    worker.deliver(task(5));

    Webhook disabled = store.webhook(webhook.id());
    assertFalse(disabled.enabled());
    assertEquals(10, disabled.failureCount());
    assertEquals("Auto-disabled after 10 consecutive failures", disabled.disabledReason());
  }

  @Test
  void successBetweenFailuresRestartsTheCount() {
    DeliveryWorker worker = worker(new RecordingTransport(200, 500, 500, 500, 500, 500, 500, 500, 500, 500, 500));

    for (int i = 0; i < 9; i++) {
      worker.deliver(task(1));
    }
    worker.deliver(task(1)); // 10th call answers 500 and disables
    assertFalse(store.webhook(webhook.id()).enabled());
    worker.deliver(task(1)); // the worker itself does not check the enabled flag

    assertEquals(0, store.webhook(webhook.id()).failureCount());
  }

  // ── Abandoned work ──────────────────────────────────────────────

  @Test
  void serializationFailureSendsNothingAndWritesNoRow() {
    RecordingTransport transport = new RecordingTransport(200);
    JsonCodec failing = new JsonCodec() {
      @Override public String toJson(Map<String, String> headers) { return null; }
      @Override public Map<String, String> parseObject(String json) { return Map.of(); }
      @Override public com.fasterxml.jackson.databind.JsonNode encodeEvent(hookrelay.event.DomainEvent e) { return null; }
      @Override public byte[] encodePayload(WebhookPayload payload) {
        throw new PayloadSerializationException("boom", null);
      }
      @Override public WebhookPayload decodePayload(String json) { return null; }
    };
    DeliveryWorker worker = DeliveryWorker.builder()
        .connectionProvider(InMemoryWebhookStore.stubCp())
        .store(store)
        .queue(queue)
        .transport(transport)
        .jsonCodec(failing)
        .build();

    assertEquals(DeliveryOutcome.ABANDONED, worker.deliver(task(1)));
    assertTrue(transport.requests.isEmpty());
    assertTrue(store.deliveries().isEmpty());
  }

  @Test
  void rowInsertFailureAbandonsAttempt() {
    store.failCreateDelivery = true;
    RecordingTransport transport = new RecordingTransport(200);

    assertEquals(DeliveryOutcome.ABANDONED, worker(transport).deliver(task(1)));
    assertTrue(transport.requests.isEmpty());
  }

  @Test
  void longResponseBodiesAreTruncated() {
    String huge = "x".repeat(10_000);
    WebhookTransport transport = (url, headers, body, timeout) -> new TransportResponse(500, huge, Map.of());

    worker(transport).deliver(task(1));

    assertEquals(4096, store.deliveries().get(0).responseBody().length());
  }

  // ── Worker thread ───────────────────────────────────────────────

  @Test
  void startedWorkerDrainsQueueBeforeClosing() throws Exception {
    RecordingTransport transport = new RecordingTransport(200);
    DeliveryWorker worker = worker(transport);
    worker.start();

    for (int i = 0; i < 5; i++) {
      queue.submit(task(1));
    }
    queue.close();
    worker.close();

    assertEquals(5, transport.requests.size());
    List<WebhookDelivery> rows = store.deliveries();
    assertEquals(5, rows.size());
    assertTrue(rows.stream().allMatch(r -> r.status() == DeliveryStatus.DELIVERED));
  }

  @Test
  void cannotRestartClosedWorker() {
    DeliveryWorker worker = worker(new RecordingTransport(200));
    worker.close();

    assertThrows(IllegalStateException.class, worker::start);
  }
}
