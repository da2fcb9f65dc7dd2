package hookrelay.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void enqueueCounters() {
    exporter.incrementEnqueued();
    exporter.incrementEnqueued();
    exporter.incrementEnqueueRejected();
    assertEquals(2.0, counter("hookrelay.enqueue").count());
    assertEquals(1.0, counter("hookrelay.enqueue.rejected").count());
  }

  @Test
  void deliveryOutcomeCounters() {
    exporter.incrementDeliverySuccess();
    exporter.incrementDeliveryFailure();
    exporter.incrementDeliveryFailure();
    exporter.incrementDeliveryExhausted();
    exporter.incrementWebhookDisabled();
    exporter.incrementRetryRequeued();
    assertEquals(1.0, counter("hookrelay.delivery.success").count());
    assertEquals(2.0, counter("hookrelay.delivery.failure").count());
    assertEquals(1.0, counter("hookrelay.delivery.exhausted").count());
    assertEquals(1.0, counter("hookrelay.webhook.disabled").count());
    assertEquals(1.0, counter("hookrelay.retry.requeued").count());
  }

  @Test
  void laggedEventsAreSummed() {
    exporter.recordEventsLagged(5);
    exporter.recordEventsLagged(0);
    exporter.recordEventsLagged(2);
    assertEquals(7.0, counter("hookrelay.events.lagged").count());
  }

  @Test
  void queueDepthGauge() {
    exporter.recordQueueDepth(42);
    assertEquals(42.0, gauge("hookrelay.queue.depth").value());

    exporter.recordQueueDepth(0);
    assertEquals(0.0, gauge("hookrelay.queue.depth").value());
  }

  @Test
  void deliveryDurationSummary() {
    exporter.recordDeliveryDurationMs(120);
    exporter.recordDeliveryDurationMs(80);

    DistributionSummary summary = registry.find("hookrelay.delivery.duration.ms").summary();
    assertNotNull(summary);
    assertEquals(2, summary.count());
    assertEquals(200.0, summary.totalAmount());
    assertEquals(120.0, summary.max());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "billing.webhooks");
    custom.incrementDeliverySuccess();
    custom.recordQueueDepth(9);

    assertEquals(1.0, counter("billing.webhooks.delivery.success").count());
    assertEquals(9.0, gauge("billing.webhooks.queue.depth").value());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.incrementEnqueued();
    exporter.close();
    exporter.incrementEnqueued();
    exporter.recordQueueDepth(3);

    assertNull(registry.find("hookrelay.enqueue").counter());
    assertNull(registry.find("hookrelay.queue.depth").gauge());
    assertNull(registry.find("hookrelay.delivery.duration.ms").summary());
  }

  @Test
  void invalidArgumentsThrow() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "hooks."));
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }
}
