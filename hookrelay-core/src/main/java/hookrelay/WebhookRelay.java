package hookrelay;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import hookrelay.delivery.DeliveryQueue;
import hookrelay.delivery.DeliveryTask;
import hookrelay.delivery.DeliveryWorker;
import hookrelay.delivery.ExponentialBackoffRetryPolicy;
import hookrelay.delivery.QueueClosedException;
import hookrelay.delivery.RetryPolicy;
import hookrelay.delivery.WebhookTransport;
import hookrelay.history.DeliveryHistory;
import hookrelay.listener.WebhookEventListener;
import hookrelay.model.Webhook;
import hookrelay.retry.RetryScheduler;
import hookrelay.spi.ConnectionProvider;
import hookrelay.spi.DomainEventSource;
import hookrelay.spi.MetricsExporter;
import hookrelay.spi.WebhookStore;
import hookrelay.util.JsonCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * Composite entry point that wires a {@link DeliveryQueue}, {@link DeliveryWorker},
 * {@link WebhookEventListener} and {@link RetryScheduler} into a single
 * {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (WebhookRelay relay = WebhookRelay.builder()
 *     .connectionProvider(connProvider)
 *     .store(store)
 *     .eventSource(events)
 *     .build()) {
 *   relay.start();
 *   events.publish(DomainEvent.of(DomainEvent.Kind.TICKET_CREATED, Map.of("ticket_id", 42)));
 * }
 * }</pre>
 *
 * @see DeliveryWorker
 * @see WebhookEventListener
 * @see RetryScheduler
 */
public final class WebhookRelay implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(WebhookRelay.class.getName());

  /** Event type of deliveries created by {@link #sendTestEvent(long)}. */
  public static final String TEST_EVENT_TYPE = "webhook.test";

  private final ConnectionProvider connectionProvider;
  private final WebhookStore store;
  private final DeliveryQueue queue;
  private final DeliveryWorker worker;
  private final WebhookEventListener listener;
  private final RetryScheduler retryScheduler;
  private final DeliveryHistory history;
  private final MetricsExporter metrics;
  private final boolean listenToEvents;

  private boolean started;
  private boolean closed;

  private WebhookRelay(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(builder.store, "store");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    JsonCodec jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();

    this.queue = new DeliveryQueue(builder.queueCapacity, metrics);
    this.worker = DeliveryWorker.builder()
        .connectionProvider(connectionProvider)
        .store(store)
        .queue(queue)
        .transport(builder.transport)
        .retryPolicy(builder.retryPolicy != null ? builder.retryPolicy
            : new ExponentialBackoffRetryPolicy(builder.initialRetryDelay.toMillis(), builder.maxRetryDelay.toMillis()))
        .maxAttempts(builder.maxAttempts)
        .autoDisableThreshold(builder.autoDisableThreshold)
        .requestTimeout(builder.requestTimeout)
        .responseBodyLimit(builder.responseBodyLimit)
        .productName(builder.productName)
        .metrics(metrics)
        .jsonCodec(jsonCodec)
        .drainTimeoutMs(builder.drainTimeout.toMillis())
        .build();
    this.listener = WebhookEventListener.builder()
        .connectionProvider(connectionProvider)
        .store(store)
        .queue(queue)
        .eventSource(builder.eventSource)
        .metrics(metrics)
        .jsonCodec(jsonCodec)
        .build();
    this.listenToEvents = builder.eventSource != null;
    this.retryScheduler = builder.retryEnabled
        ? RetryScheduler.builder()
            .connectionProvider(connectionProvider)
            .store(store)
            .queue(queue)
            .batchSize(builder.retryBatchSize)
            .intervalMs(builder.retryInterval.toMillis())
            .metrics(metrics)
            .jsonCodec(jsonCodec)
            .build()
        : null;
    this.history = new DeliveryHistory(connectionProvider, store);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the worker, the retry scheduler (if enabled) and the event listener
   * (if an event source is configured). Subsequent calls are no-ops.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("WebhookRelay has been closed");
    }
    if (started) {
      return;
    }
    started = true;
    worker.start();
    if (retryScheduler != null) {
      retryScheduler.start();
    }
    if (listenToEvents) {
      listener.start();
    }
    logger.info("Webhook relay started");
  }

  /**
   * Queues a {@value #TEST_EVENT_TYPE} delivery to one webhook, ignoring its event
   * subscriptions and enabled flag. The result shows up in delivery history.
   *
   * @param webhookId the webhook id
   * @return id of the queued envelope
   * @throws WebhookNotFoundException if the webhook does not exist
   * @throws IllegalStateException    if the webhook cannot be loaded
   * @throws QueueClosedException     if the relay has been closed
   * @throws InterruptedException     if interrupted while waiting for queue space
   */
  public UUID sendTestEvent(long webhookId) throws InterruptedException {
    Optional<Webhook> found;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      found = store.findWebhook(conn, webhookId);
    } catch (SQLException | RuntimeException e) {
      throw new IllegalStateException("Failed to load webhook " + webhookId, e);
    }
    Webhook webhook = found.orElseThrow(() -> new WebhookNotFoundException(webhookId));

    ObjectNode data = JsonNodeFactory.instance.objectNode();
    data.put("message", "This is a test webhook delivery");
    data.put("webhook_id", webhook.uuid() == null ? null : webhook.uuid().toString());
    data.put("webhook_name", webhook.name());
    WebhookPayload payload = WebhookPayload.create(TEST_EVENT_TYPE, data);

    queue.submit(DeliveryTask.of(webhook, payload, 1));
    return payload.id();
  }

  /**
   * Lists the event types webhooks can subscribe to.
   *
   * @return dotted event type names
   */
  public List<String> availableEventTypes() {
    return WebhookEventType.all();
  }

  public DeliveryHistory history() {
    return history;
  }

  public DeliveryQueue queue() {
    return queue;
  }

  public WebhookEventListener listener() {
    return listener;
  }

  public DeliveryWorker worker() {
    return worker;
  }

  /** The retry scheduler, or {@code null} if retries were disabled on the builder. */
  public RetryScheduler retryScheduler() {
    return retryScheduler;
  }

  /**
   * Shuts down components in order: listener, retry scheduler, queue, worker.
   * The worker drains queued tasks within the drain timeout.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    RuntimeException first = null;
    try {
      listener.close();
    } catch (RuntimeException e) {
      first = e;
    }
    if (retryScheduler != null) {
      try {
        retryScheduler.close();
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    queue.close();
    try {
      worker.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link WebhookRelay}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private WebhookStore store;
    private DomainEventSource eventSource;
    private WebhookTransport transport;
    private RetryPolicy retryPolicy;
    private MetricsExporter metrics;
    private JsonCodec jsonCodec;
    private int queueCapacity = DeliveryQueue.DEFAULT_CAPACITY;
    private int maxAttempts = 5;
    private int autoDisableThreshold = 10;
    private Duration requestTimeout = Duration.ofSeconds(30);
    private int responseBodyLimit = 4096;
    private String productName = DeliveryWorker.DEFAULT_PRODUCT_NAME;
    private Duration initialRetryDelay = Duration.ofSeconds(1);
    private Duration maxRetryDelay = Duration.ofHours(1);
    private boolean retryEnabled = true;
    private Duration retryInterval = Duration.ofSeconds(30);
    private int retryBatchSize = 100;
    private Duration drainTimeout = Duration.ofSeconds(5);

    private Builder() {}

    /**
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @param store the persistence backend
     * @return this builder
     */
    public Builder store(WebhookStore store) {
      this.store = store;
      return this;
    }

    /**
     * Sets the domain event source the listener subscribes to on {@link WebhookRelay#start()}.
     *
     * <p>Optional. Without one, only test events and retries are delivered.
     *
     * @param eventSource the event source
     * @return this builder
     */
    public Builder eventSource(DomainEventSource eventSource) {
      this.eventSource = eventSource;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link hookrelay.delivery.OkHttpWebhookTransport}.
     *
     * @param transport the HTTP transport
     * @return this builder
     */
    public Builder transport(WebhookTransport transport) {
      this.transport = transport;
      return this;
    }

    /**
     * Replaces the backoff policy. When set, {@link #initialRetryDelay} and
     * {@link #maxRetryDelay} are ignored.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}. Closed with the relay if it
     * implements {@link AutoCloseable}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 1000}.
     *
     * @param queueCapacity bound of the delivery queue
     * @return this builder
     */
    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 5}.
     *
     * @param maxAttempts attempts per delivery chain
     * @return this builder
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 10}.
     *
     * @param autoDisableThreshold consecutive failures that disable a webhook
     * @return this builder
     */
    public Builder autoDisableThreshold(int autoDisableThreshold) {
      this.autoDisableThreshold = autoDisableThreshold;
      return this;
    }

    public Builder requestTimeout(Duration requestTimeout) {
      this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
      return this;
    }

    public Builder responseBodyLimit(int responseBodyLimit) {
      this.responseBodyLimit = responseBodyLimit;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@value DeliveryWorker#DEFAULT_PRODUCT_NAME}.
     *
     * @param productName name used in {@code X-<name>-*} headers and the user agent
     * @return this builder
     */
    public Builder productName(String productName) {
      this.productName = productName;
      return this;
    }

    public Builder initialRetryDelay(Duration initialRetryDelay) {
      this.initialRetryDelay = Objects.requireNonNull(initialRetryDelay, "initialRetryDelay");
      return this;
    }

    public Builder maxRetryDelay(Duration maxRetryDelay) {
      this.maxRetryDelay = Objects.requireNonNull(maxRetryDelay, "maxRetryDelay");
      return this;
    }

    /**
     * Turns the retry scheduler off, e.g. when another instance runs it.
     * Failed attempts still get a {@code next_retry_at}.
     *
     * <p>Optional. Defaults to {@code true}.
     *
     * @param retryEnabled whether this relay runs a retry scheduler
     * @return this builder
     */
    public Builder retryEnabled(boolean retryEnabled) {
      this.retryEnabled = retryEnabled;
      return this;
    }

    public Builder retryInterval(Duration retryInterval) {
      this.retryInterval = Objects.requireNonNull(retryInterval, "retryInterval");
      return this;
    }

    public Builder retryBatchSize(int retryBatchSize) {
      this.retryBatchSize = retryBatchSize;
      return this;
    }

    /**
     * <p>Optional. Defaults to 5 seconds.
     *
     * @param drainTimeout how long {@link WebhookRelay#close()} waits for queued deliveries
     * @return this builder
     */
    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = Objects.requireNonNull(drainTimeout, "drainTimeout");
      return this;
    }

    /**
     * Builds the relay. Call {@link WebhookRelay#start()} to begin delivering.
     *
     * @return a new {@link WebhookRelay}
     * @throws NullPointerException     if {@code connectionProvider} or {@code store} is null
     * @throws IllegalArgumentException if a numeric setting is out of range
     */
    public WebhookRelay build() {
      return new WebhookRelay(this);
    }
  }
}
