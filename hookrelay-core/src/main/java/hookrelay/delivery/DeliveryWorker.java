package hookrelay.delivery;

import hookrelay.model.DeliveryUpdate;
import hookrelay.model.NewDelivery;
import hookrelay.model.WebhookUpdate;
import hookrelay.signature.WebhookSignatures;
import hookrelay.spi.ConnectionProvider;
import hookrelay.spi.MetricsExporter;
import hookrelay.spi.WebhookStore;
import hookrelay.util.DaemonThreadFactory;
import hookrelay.util.JsonCodec;
import hookrelay.util.PayloadSerializationException;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single consumer of the {@link DeliveryQueue}: signs, sends and records each
 * delivery attempt.
 *
 * <p>For every task the worker writes a delivery row before the HTTP call, then
 * completes that row with the outcome. A 2xx answer resets the webhook's failure
 * streak. Anything else schedules the next attempt (until {@code maxAttempts} is
 * reached) and increments the streak, which disables the webhook once it reaches
 * {@code autoDisableThreshold}.
 *
 * <p>Tasks are processed one at a time, in queue order. Create instances via
 * {@link #builder()} and call {@link #start()}; {@link #deliver(DeliveryTask)} may
 * also be called directly.
 *
 * @see DeliveryWorker.Builder
 */
public final class DeliveryWorker implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(DeliveryWorker.class.getName());

  public static final String DEFAULT_PRODUCT_NAME = "Hookrelay";
  public static final String REDACTED_SIGNATURE = WebhookSignatures.PREFIX + "***";

  private static final Duration QUEUE_POLL_TIMEOUT = Duration.ofMillis(50);
  private static final int MAX_ERROR_LENGTH = 4000;
  private static final Set<String> BLOCKED_CUSTOM_HEADERS = Set.of("host", "user-agent", "authorization");

  private final ConnectionProvider connectionProvider;
  private final WebhookStore store;
  private final DeliveryQueue queue;
  private final WebhookTransport transport;
  private final RetryPolicy retryPolicy;
  private final int maxAttempts;
  private final int autoDisableThreshold;
  private final Duration requestTimeout;
  private final int responseBodyLimit;
  private final String signatureHeader;
  private final String eventHeader;
  private final String deliveryHeader;
  private final String userAgent;
  private final MetricsExporter metrics;
  private final JsonCodec jsonCodec;
  private final long drainTimeoutMs;

  private ExecutorService executor;
  private volatile boolean closed;

  private DeliveryWorker(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(builder.store, "store");
    this.queue = Objects.requireNonNull(builder.queue, "queue");
    this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : new ExponentialBackoffRetryPolicy();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();

    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (builder.autoDisableThreshold < 1) {
      throw new IllegalArgumentException("autoDisableThreshold must be >= 1");
    }
    if (builder.requestTimeout == null || builder.requestTimeout.isNegative() || builder.requestTimeout.isZero()) {
      throw new IllegalArgumentException("requestTimeout must be positive");
    }
    if (builder.responseBodyLimit < 0) {
      throw new IllegalArgumentException("responseBodyLimit must be >= 0");
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    String product = builder.productName;
    if (product == null || product.isBlank() || !product.matches("[A-Za-z0-9-]+")) {
      throw new IllegalArgumentException("productName must be a non-empty header token, got: " + product);
    }
    this.maxAttempts = builder.maxAttempts;
    this.autoDisableThreshold = builder.autoDisableThreshold;
    this.requestTimeout = builder.requestTimeout;
    this.responseBodyLimit = builder.responseBodyLimit;
    // UTF-8 needs at most 4 bytes per char
    this.transport = builder.transport != null ? builder.transport
        : new OkHttpWebhookTransport(OkHttpWebhookTransport.DEFAULT_CONNECT_TIMEOUT, 4L * responseBodyLimit);
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.signatureHeader = "X-" + product + "-Signature";
    this.eventHeader = "X-" + product + "-Event";
    this.deliveryHeader = "X-" + product + "-Delivery";
    this.userAgent = product + "-Webhook/1.0";
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the consumer thread. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("DeliveryWorker has been closed");
    }
    if (executor != null) {
      return;
    }
    executor = Executors.newSingleThreadExecutor(new DaemonThreadFactory("hookrelay-delivery-"));
    executor.submit(this::workerLoop);
  }

  private void workerLoop() {
    while (!Thread.currentThread().isInterrupted()) {
      try {
        DeliveryTask task = queue.poll(QUEUE_POLL_TIMEOUT);
        if (task == null) {
          if (queue.isDrained()) break;
          continue;
        }
        deliver(task);
        metrics.recordQueueDepth(queue.size());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Delivery loop error", t);
      }
    }
  }

  /**
   * Performs one attempt: serialize, sign, record, send, record the outcome.
   *
   * @param task the attempt to perform
   * @return what happened
   */
  public DeliveryOutcome deliver(DeliveryTask task) {
    byte[] body;
    try {
      body = jsonCodec.encodePayload(task.payload());
    } catch (PayloadSerializationException e) {
      logger.log(Level.SEVERE, "Dropping delivery for webhookId=" + task.webhookId()
          + ": payload could not be serialized", e);
      return DeliveryOutcome.ABANDONED;
    }

    String signature = WebhookSignatures.sign(body, task.secret());
    Map<String, String> headers = requestHeaders(task, signature);

    long deliveryId = createDelivery(task, new String(body, StandardCharsets.UTF_8));
    if (deliveryId < 0) {
      return DeliveryOutcome.ABANDONED;
    }

    TransportResponse response = null;
    String error = null;
    long started = System.nanoTime();
    try {
      response = transport.send(task.url(), headers, body, requestTimeout);
    } catch (InterruptedIOException e) {
      if (Thread.currentThread().isInterrupted()) {
        error = "Delivery interrupted";
      } else {
        error = "Request timed out after " + requestTimeout.toSeconds() + "s";
      }
    } catch (IOException e) {
      error = describe(e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      error = "Delivery interrupted";
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Transport failed unexpectedly for webhookId=" + task.webhookId(), e);
      error = describe(e);
    }
    long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
    metrics.recordDeliveryDurationMs(durationMs);

    if (response != null && response.isSuccess()) {
      recordSuccess(task, deliveryId, response, durationMs);
      return DeliveryOutcome.DELIVERED;
    }
    return recordFailure(task, deliveryId, response, durationMs, error);
  }

  /**
   * Headers sent with every request. Custom headers cannot replace the relay's own
   * headers, and {@code Host}, {@code User-Agent} and {@code Authorization} are
   * never taken from webhook configuration.
   */
  Map<String, String> requestHeaders(DeliveryTask task, String signature) {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("Content-Type", "application/json");
    headers.put(signatureHeader, signature);
    headers.put(eventHeader, task.payload().eventType());
    headers.put(deliveryHeader, task.payload().id().toString());
    headers.put("User-Agent", userAgent);

    Set<String> reserved = new HashSet<>(BLOCKED_CUSTOM_HEADERS);
    headers.keySet().forEach(name -> reserved.add(name.toLowerCase(Locale.ROOT)));
    for (Map.Entry<String, String> custom : task.headers().entrySet()) {
      String name = custom.getKey();
      if (reserved.contains(name.toLowerCase(Locale.ROOT))) {
        logger.fine("Ignoring custom header " + name + " for webhookId=" + task.webhookId());
        continue;
      }
      headers.put(name, custom.getValue());
    }
    return headers;
  }

  /** Copy of the identifying headers stored with the delivery row; the signature is redacted. */
  Map<String, String> recordedHeaders(DeliveryTask task) {
    Map<String, String> recorded = new LinkedHashMap<>();
    recorded.put(signatureHeader, REDACTED_SIGNATURE);
    recorded.put(eventHeader, task.payload().eventType());
    recorded.put(deliveryHeader, task.payload().id().toString());
    return recorded;
  }

  private long createDelivery(DeliveryTask task, String payloadJson) {
    NewDelivery delivery = new NewDelivery(
        UUID.randomUUID(),
        task.webhookId(),
        task.payload().eventType(),
        payloadJson,
        recordedHeaders(task),
        task.attempt());
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return store.createDelivery(conn, delivery);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to record delivery for webhookId=" + task.webhookId()
          + ", attempt=" + task.attempt() + "; attempt abandoned", e);
      return -1L;
    }
  }

  private void recordSuccess(DeliveryTask task, long deliveryId, TransportResponse response, long durationMs) {
    Instant now = Instant.now();
    DeliveryUpdate update = DeliveryUpdate.builder()
        .responseStatus(response.status())
        .responseBody(truncate(response.body(), responseBodyLimit))
        .responseHeaders(response.headers())
        .durationMs(durationMs)
        .deliveredAt(now)
        .nextRetryAt(null)
        .build();
    withConnection("record success", task.webhookId(), conn -> {
      store.updateDelivery(conn, deliveryId, update);
      store.updateWebhook(conn, task.webhookId(), WebhookUpdate.succeeded(now));
    });
    metrics.incrementDeliverySuccess();
    logger.fine("Delivered " + task.payload().eventType() + " to webhookId=" + task.webhookId()
        + " status=" + response.status() + " in " + durationMs + "ms");
  }

  private DeliveryOutcome recordFailure(DeliveryTask task, long deliveryId, TransportResponse response,
                                        long durationMs, String error) {
    Instant nextRetryAt = task.attempt() < maxAttempts
        ? Instant.now().plusMillis(retryPolicy.computeDelayMs(task.attempt()))
        : null;
    int status = response == null ? 0 : response.status();

    DeliveryUpdate.Builder update = DeliveryUpdate.builder()
        .responseStatus(status)
        .durationMs(durationMs)
        .errorMessage(truncate(error, MAX_ERROR_LENGTH))
        .nextRetryAt(nextRetryAt);
    if (response != null) {
      update.responseBody(truncate(response.body(), responseBodyLimit))
          .responseHeaders(response.headers());
    }

    withConnection("record failure", task.webhookId(), conn -> {
      store.updateDelivery(conn, deliveryId, update.build());
      int failures = store.incrementFailureCount(conn, task.webhookId(), autoDisableThreshold);
      if (failures == autoDisableThreshold) {
        metrics.incrementWebhookDisabled();
        logger.warning("Webhook " + task.webhookId() + " auto-disabled after "
            + failures + " consecutive failures");
      }
    });

    logger.warning("Delivery failed for webhookId=" + task.webhookId()
        + ", attempt=" + task.attempt() + ", status=" + status
        + (error != null ? ", error=" + error : "")
        + (nextRetryAt != null ? ", next retry at " + nextRetryAt : ", no retries left"));

    if (nextRetryAt != null) {
      metrics.incrementDeliveryFailure();
      return DeliveryOutcome.RETRY_SCHEDULED;
    }
    metrics.incrementDeliveryExhausted();
    return DeliveryOutcome.EXHAUSTED;
  }

  private void withConnection(String action, long webhookId, SqlAction op) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      op.execute(conn);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to " + action + " for webhookId=" + webhookId, e);
    }
  }

  @FunctionalInterface
  private interface SqlAction {
    void execute(Connection conn) throws SQLException;
  }

  private static String describe(Exception e) {
    String message = e.getMessage();
    return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
  }

  static String truncate(String value, int limit) {
    if (value == null || value.length() <= limit) {
      return value;
    }
    return value.substring(0, limit);
  }

  /**
   * Stops the consumer after the queue is closed and drained, waiting up to the
   * drain timeout before interrupting it. Does not close the queue.
   */
  @Override
  public synchronized void close() {
    closed = true;
    if (executor == null) {
      return;
    }
    executor.shutdown();
    try {
      if (!executor.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown. Remaining tasks: " + queue.size());
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link DeliveryWorker}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private WebhookStore store;
    private DeliveryQueue queue;
    private WebhookTransport transport;
    private RetryPolicy retryPolicy;
    private int maxAttempts = 5;
    private int autoDisableThreshold = 10;
    private Duration requestTimeout = Duration.ofSeconds(30);
    private int responseBodyLimit = 4096;
    private String productName = DEFAULT_PRODUCT_NAME;
    private MetricsExporter metrics;
    private JsonCodec jsonCodec;
    private long drainTimeoutMs = 5000;

    private Builder() {}

    /**
     * Sets the connection provider used to write delivery rows and webhook health.
     *
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
     * Sets the store holding webhooks and delivery history.
     *
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
     * Sets the queue this worker drains.
     *
     * <p><b>Required.</b>
     *
     * @param queue the delivery queue
     * @return this builder
     */
    public Builder queue(DeliveryQueue queue) {
      this.queue = queue;
      return this;
    }

    /**
     * Sets the HTTP transport.
     *
     * <p>Optional. Defaults to {@link OkHttpWebhookTransport}.
     *
     * @param transport the transport
     * @return this builder
     */
    public Builder transport(WebhookTransport transport) {
      this.transport = transport;
      return this;
    }

    /**
     * Sets the policy computing the delay before the next attempt.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with a 1 s initial
     * delay and a 1 h cap.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the number of attempts per delivery chain, the first one included.
     *
     * <p>Optional. Defaults to {@code 5}. Must be &ge; 1.
     *
     * @param maxAttempts attempts per chain
     * @return this builder
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Sets the consecutive failure count that disables a webhook.
     *
     * <p>Optional. Defaults to {@code 10}. Must be &ge; 1.
     *
     * @param autoDisableThreshold failures before disabling
     * @return this builder
     */
    public Builder autoDisableThreshold(int autoDisableThreshold) {
      this.autoDisableThreshold = autoDisableThreshold;
      return this;
    }

    /**
     * Sets the overall timeout for one HTTP attempt.
     *
     * <p>Optional. Defaults to 30 seconds.
     *
     * @param requestTimeout the timeout
     * @return this builder
     */
    public Builder requestTimeout(Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
      return this;
    }

    /**
     * Sets the maximum number of response body characters stored per attempt.
     *
     * <p>Optional. Defaults to {@code 4096}.
     *
     * @param responseBodyLimit character limit
     * @return this builder
     */
    public Builder responseBodyLimit(int responseBodyLimit) {
      this.responseBodyLimit = responseBodyLimit;
      return this;
    }

    /**
     * Sets the product name used in {@code X-<name>-Signature}, {@code X-<name>-Event},
     * {@code X-<name>-Delivery} and {@code User-Agent: <name>-Webhook/1.0}.
     *
     * <p>Optional. Defaults to {@value #DEFAULT_PRODUCT_NAME}.
     *
     * @param productName letters, digits and dashes
     * @return this builder
     */
    public Builder productName(String productName) {
      this.productName = productName;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the codec used to serialize envelopes.
     *
     * <p>Optional. Defaults to {@link JsonCodec#getDefault()}.
     *
     * @param jsonCodec the codec
     * @return this builder
     */
    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    /**
     * Sets how long {@link #close()} waits for the queue to drain.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Builds the worker. Call {@link DeliveryWorker#start()} to begin consuming.
     *
     * @return a new {@link DeliveryWorker}
     * @throws NullPointerException     if {@code connectionProvider}, {@code store} or
     *                                  {@code queue} is null
     * @throws IllegalArgumentException if a numeric setting is out of range or the
     *                                  product name is not a header token
     */
    public DeliveryWorker build() {
      return new DeliveryWorker(this);
    }
  }
}
