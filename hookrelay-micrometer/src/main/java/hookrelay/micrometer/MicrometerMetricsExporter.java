package hookrelay.micrometer;

import hookrelay.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code hookrelay.enqueue} - delivery tasks accepted by the queue</li>
 *   <li>{@code hookrelay.enqueue.rejected} - tasks refused because the queue was closed</li>
 *   <li>{@code hookrelay.delivery.success} - attempts answered with 2xx</li>
 *   <li>{@code hookrelay.delivery.failure} - failed attempts with a retry scheduled</li>
 *   <li>{@code hookrelay.delivery.exhausted} - failed attempts that ended their chain</li>
 *   <li>{@code hookrelay.webhook.disabled} - webhooks auto-disabled</li>
 *   <li>{@code hookrelay.retry.requeued} - retries handed back to the queue</li>
 *   <li>{@code hookrelay.events.lagged} - domain events skipped by a lagging listener</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code hookrelay.queue.depth} - current delivery queue depth</li>
 * </ul>
 *
 * <h3>Summaries</h3>
 * <ul>
 *   <li>{@code hookrelay.delivery.duration.ms} - wall-clock duration of HTTP attempts</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  public static final String DEFAULT_NAME_PREFIX = "hookrelay";

  private final MeterRegistry registry;
  private final Counter enqueued;
  private final Counter enqueueRejected;
  private final Counter deliverySuccess;
  private final Counter deliveryFailure;
  private final Counter deliveryExhausted;
  private final Counter webhookDisabled;
  private final Counter retryRequeued;
  private final Counter eventsLagged;
  private final Gauge queueDepthGauge;
  private final DistributionSummary deliveryDuration;

  private final AtomicInteger queueDepth = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "hookrelay"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, DEFAULT_NAME_PREFIX);
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "billing.webhooks"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.enqueued = counter(namePrefix + ".enqueue", "Delivery tasks accepted by the queue");
    this.enqueueRejected = counter(namePrefix + ".enqueue.rejected", "Delivery tasks refused by a closed queue");
    this.deliverySuccess = counter(namePrefix + ".delivery.success", "Delivery attempts answered with 2xx");
    this.deliveryFailure = counter(namePrefix + ".delivery.failure", "Failed attempts with a retry scheduled");
    this.deliveryExhausted = counter(namePrefix + ".delivery.exhausted", "Failed attempts that ended their chain");
    this.webhookDisabled = counter(namePrefix + ".webhook.disabled", "Webhooks auto-disabled");
    this.retryRequeued = counter(namePrefix + ".retry.requeued", "Retries handed back to the queue");
    this.eventsLagged = counter(namePrefix + ".events.lagged", "Domain events skipped by a lagging listener");

    this.queueDepthGauge = Gauge.builder(namePrefix + ".queue.depth", queueDepth, AtomicInteger::get)
        .description("Current delivery queue depth")
        .register(registry);
    this.deliveryDuration = DistributionSummary.builder(namePrefix + ".delivery.duration.ms")
        .description("Wall-clock duration of delivery attempts")
        .baseUnit("milliseconds")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementEnqueued() {
    if (closed) return;
    enqueued.increment();
  }

  @Override
  public void incrementEnqueueRejected() {
    if (closed) return;
    enqueueRejected.increment();
  }

  @Override
  public void incrementDeliverySuccess() {
    if (closed) return;
    deliverySuccess.increment();
  }

  @Override
  public void incrementDeliveryFailure() {
    if (closed) return;
    deliveryFailure.increment();
  }

  @Override
  public void incrementDeliveryExhausted() {
    if (closed) return;
    deliveryExhausted.increment();
  }

  @Override
  public void incrementWebhookDisabled() {
    if (closed) return;
    webhookDisabled.increment();
  }

  @Override
  public void incrementRetryRequeued() {
    if (closed) return;
    retryRequeued.increment();
  }

  @Override
  public void recordEventsLagged(long count) {
    if (closed || count <= 0) return;
    eventsLagged.increment(count);
  }

  @Override
  public void recordQueueDepth(int depth) {
    if (closed) return;
    queueDepth.set(depth);
  }

  @Override
  public void recordDeliveryDurationMs(long durationMs) {
    if (closed) return;
    deliveryDuration.record(durationMs);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>{@link hookrelay.WebhookRelay#close()} calls this so that a stopped relay
   * leaves no stale gauge behind.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(enqueued, enqueueRejected, deliverySuccess, deliveryFailure,
        deliveryExhausted, webhookDisabled, retryRequeued, eventsLagged,
        queueDepthGauge, deliveryDuration)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
