package hookrelay.listener;

import com.fasterxml.jackson.databind.JsonNode;
import hookrelay.WebhookEventType;
import hookrelay.WebhookPayload;
import hookrelay.delivery.DeliveryQueue;
import hookrelay.delivery.DeliveryTask;
import hookrelay.delivery.QueueClosedException;
import hookrelay.event.DomainEvent;
import hookrelay.model.Webhook;
import hookrelay.spi.ConnectionProvider;
import hookrelay.spi.DomainEventSource;
import hookrelay.spi.DomainEventSubscription;
import hookrelay.spi.MetricsExporter;
import hookrelay.spi.WebhookStore;
import hookrelay.util.DaemonThreadFactory;
import hookrelay.util.JsonCodec;
import hookrelay.util.PayloadSerializationException;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns domain events into delivery tasks.
 *
 * <p>For each event that maps to a {@link WebhookEventType}, the listener loads the
 * enabled webhooks subscribed to that type, builds one envelope shared by all of
 * them, and queues one first-attempt task per webhook. Internal events
 * (heartbeats, viewer counts, notifications) are ignored.
 *
 * <p>{@link #start()} subscribes to the configured {@link DomainEventSource} and
 * consumes it on a dedicated thread. Events missed because the listener fell
 * behind are logged and counted, not recovered.
 */
public final class WebhookEventListener implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(WebhookEventListener.class.getName());

    private final ConnectionProvider connectionProvider;
    private final WebhookStore store;
    private final DeliveryQueue queue;
    private final DomainEventSource eventSource;
    private final MetricsExporter metrics;
    private final JsonCodec jsonCodec;
    private final Duration receiveTimeout;

    private ExecutorService executor;
    private DomainEventSubscription subscription;
    private volatile boolean closed;

    private WebhookEventListener(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.store = Objects.requireNonNull(builder.store, "store");
        this.queue = Objects.requireNonNull(builder.queue, "queue");
        this.eventSource = builder.eventSource;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
        if (builder.receiveTimeout == null || builder.receiveTimeout.isNegative() || builder.receiveTimeout.isZero()) {
            throw new IllegalArgumentException("receiveTimeout must be positive");
        }
        this.receiveTimeout = builder.receiveTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Subscribes to the event source and starts consuming. Subsequent calls are no-ops.
     *
     * @throws IllegalStateException if no event source was configured or the listener is closed
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("WebhookEventListener has been closed");
        }
        if (eventSource == null) {
            throw new IllegalStateException("No event source configured");
        }
        if (executor != null) {
            return;
        }
        subscription = eventSource.subscribe();
        executor = Executors.newSingleThreadExecutor(new DaemonThreadFactory("hookrelay-listener-"));
        DomainEventSubscription current = subscription;
        executor.submit(() -> listenLoop(current));
        logger.info("Webhook event listener started");
    }

    private void listenLoop(DomainEventSubscription events) {
        while (!closed && !Thread.currentThread().isInterrupted()) {
            try {
                long lagged = events.takeLagged();
                if (lagged > 0) {
                    metrics.recordEventsLagged(lagged);
                    logger.warning("Webhook event listener lagged, skipped " + lagged + " events");
                }
                DomainEvent event = events.receive(receiveTimeout);
                if (event == null) {
                    if (events.isClosed()) {
                        logger.info("Event source closed, webhook event listener stopping");
                        break;
                    }
                    continue;
                }
                process(event);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (Throwable t) {
                logger.log(Level.SEVERE, "Webhook event listener error", t);
            }
        }
    }

    /**
     * Handles one domain event synchronously.
     *
     * @param event the event
     * @return number of delivery tasks queued
     * @throws InterruptedException if interrupted while waiting for queue space
     */
    public int process(DomainEvent event) throws InterruptedException {
        WebhookEventType type = WebhookEventType.forDomainEvent(event.kind());
        if (type == null) {
            return 0;
        }

        List<Webhook> webhooks;
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            webhooks = store.findWebhooksForEvent(conn, type.wireName());
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to load webhooks for " + type.wireName(), e);
            return 0;
        }
        if (webhooks.isEmpty()) {
            return 0;
        }

        JsonNode data;
        try {
            data = jsonCodec.encodeEvent(event);
        } catch (PayloadSerializationException e) {
            logger.log(Level.SEVERE, "Failed to serialize " + event.kind().tag() + "; event skipped", e);
            return 0;
        }
        WebhookPayload payload = WebhookPayload.create(type.wireName(), data);

        int queued = 0;
        for (Webhook webhook : webhooks) {
            try {
                queue.submit(DeliveryTask.of(webhook, payload, 1));
                queued++;
            } catch (QueueClosedException e) {
                logger.severe("Delivery queue closed; dropped " + (webhooks.size() - queued)
                    + " deliveries of " + type.wireName() + " (" + payload.id() + ")");
                break;
            }
        }
        return queued;
    }

    /**
     * Stops consuming and closes the subscription. Events already queued are unaffected.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (subscription != null) {
            subscription.close();
        }
        if (executor != null) {
            executor.shutdownNow();
            try {
                executor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Builder for {@link WebhookEventListener}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private WebhookStore store;
        private DeliveryQueue queue;
        private DomainEventSource eventSource;
        private MetricsExporter metrics;
        private JsonCodec jsonCodec;
        private Duration receiveTimeout = Duration.ofMillis(200);

        private Builder() {
        }

        /**
         * Sets the connection provider used for subscription lookups.
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
         * Sets the store that resolves subscribed webhooks.
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
         * Sets the queue receiving delivery tasks.
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
         * Sets the source {@link WebhookEventListener#start()} subscribes to.
         *
         * <p>Optional. Without one, events can only be fed through {@link #process}.
         *
         * @param eventSource the event source
         * @return this builder
         */
        public Builder eventSource(DomainEventSource eventSource) {
            this.eventSource = eventSource;
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
         * Sets the codec used to serialize domain events.
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
         * Sets how long one receive call waits before re-checking for lag and shutdown.
         *
         * <p>Optional. Defaults to 200 ms.
         *
         * @param receiveTimeout receive wait
         * @return this builder
         */
        public Builder receiveTimeout(Duration receiveTimeout) {
            this.receiveTimeout = receiveTimeout;
            return this;
        }

        public WebhookEventListener build() {
            return new WebhookEventListener(this);
        }
    }
}
