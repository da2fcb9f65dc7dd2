package hookrelay.retry;

import hookrelay.WebhookPayload;
import hookrelay.delivery.DeliveryQueue;
import hookrelay.delivery.DeliveryTask;
import hookrelay.delivery.QueueClosedException;
import hookrelay.model.DeliveryUpdate;
import hookrelay.model.Webhook;
import hookrelay.model.WebhookDelivery;
import hookrelay.spi.ConnectionProvider;
import hookrelay.spi.MetricsExporter;
import hookrelay.spi.WebhookStore;
import hookrelay.util.DaemonThreadFactory;
import hookrelay.util.JsonCodec;
import hookrelay.util.PayloadSerializationException;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic scan that hands due retries back to the {@link DeliveryQueue}.
 *
 * <p>Each cycle loads up to {@code batchSize} undelivered rows whose
 * {@code next_retry_at} has passed, oldest first. A row is claimed (its
 * {@code next_retry_at} cleared) before its follow-up attempt is queued, so it is
 * handed off once even when several schedulers share the database. The follow-up
 * reuses the stored envelope unchanged, with the attempt number incremented.
 *
 * <p>Rows whose webhook was deleted or disabled in the meantime are claimed and
 * not requeued: their chain ends there.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see RetryScheduler.Builder
 */
public final class RetryScheduler implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(RetryScheduler.class.getName());

    private final ConnectionProvider connectionProvider;
    private final WebhookStore store;
    private final DeliveryQueue queue;
    private final int batchSize;
    private final long intervalMs;
    private final MetricsExporter metrics;
    private final JsonCodec jsonCodec;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> scanTask;
    private volatile boolean closed;

    private RetryScheduler(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.store = Objects.requireNonNull(builder.store, "store");
        this.queue = Objects.requireNonNull(builder.queue, "queue");

        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (builder.intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        this.batchSize = builder.batchSize;
        this.intervalMs = builder.intervalMs;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the scan schedule. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("RetryScheduler has been closed");
        }
        if (scanTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("hookrelay-retry-"));
        scanTask = scheduler.scheduleWithFixedDelay(this::scan, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Executes a single scan cycle. Called automatically by the scheduler, but may also be invoked directly.
     *
     * @return number of retries queued in this cycle
     */
    public int scan() {
        if (closed) {
            return 0;
        }
        try {
            List<WebhookDelivery> due = fetchDueRetries(Instant.now());
            if (due == null || due.isEmpty()) {
                return 0;
            }
            int requeued = 0;
            for (WebhookDelivery row : due) {
                if (queue.isClosed()) {
                    break;
                }
                if (requeue(row)) {
                    requeued++;
                }
            }
            if (requeued > 0) {
                logger.fine("Requeued " + requeued + " of " + due.size() + " due webhook retries");
            }
            return requeued;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 0;
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Retry scan failed", t);
            return 0;
        }
    }

    /**
     * Returns {@code null} on failure to distinguish it from an empty result.
     */
    private List<WebhookDelivery> fetchDueRetries(Instant now) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return store.findPendingRetries(conn, now, batchSize);
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to fetch pending webhook retries", e);
            return null;
        }
    }

    private boolean requeue(WebhookDelivery row) throws InterruptedException {
        Instant scheduledAt = row.nextRetryAt();
        Optional<Webhook> webhook;
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            if (!store.claimRetry(conn, row.id(), Instant.now())) {
                // Claimed elsewhere since the fetch
                return false;
            }
            webhook = store.findWebhook(conn, row.webhookId());
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to claim retry for deliveryId=" + row.id(), e);
            return false;
        }

        if (webhook.isEmpty() || !webhook.get().enabled()) {
            logger.info("Dropping retry of deliveryId=" + row.id() + ": webhook "
                + row.webhookId() + (webhook.isEmpty() ? " no longer exists" : " is disabled"));
            return false;
        }

        WebhookPayload payload;
        try {
            payload = jsonCodec.decodePayload(row.payloadJson());
        } catch (PayloadSerializationException e) {
            logger.log(Level.SEVERE, "Stored payload of deliveryId=" + row.id() + " is unreadable; retry dropped", e);
            finalizeUnreadable(row.id(), e);
            return false;
        }

        try {
            queue.submit(DeliveryTask.of(webhook.get(), payload, row.attemptNumber() + 1));
        } catch (QueueClosedException e) {
            logger.warning("Delivery queue closed; restoring retry of deliveryId=" + row.id());
            restoreClaim(row.id(), scheduledAt);
            return false;
        } catch (InterruptedException e) {
            restoreClaim(row.id(), scheduledAt);
            throw e;
        }
        metrics.incrementRetryRequeued();
        return true;
    }

    private void restoreClaim(long deliveryId, Instant scheduledAt) {
        withConnection("restore retry", deliveryId, conn ->
            store.updateDelivery(conn, deliveryId, DeliveryUpdate.builder().nextRetryAt(scheduledAt).build()));
    }

    private void finalizeUnreadable(long deliveryId, Exception failure) {
        withConnection("finalize unreadable retry", deliveryId, conn ->
            store.updateDelivery(conn, deliveryId, DeliveryUpdate.builder()
                .nextRetryAt(null)
                .errorMessage("Stored payload could not be decoded: " + failure.getMessage())
                .build()));
    }

    private void withConnection(String action, long deliveryId, SqlAction op) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            op.execute(conn);
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to " + action + " for deliveryId=" + deliveryId, e);
        }
    }

    @FunctionalInterface
    private interface SqlAction {
        void execute(Connection conn) throws SQLException;
    }

    /**
     * Cancels the scan schedule and shuts down the scheduler thread.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (scanTask != null) {
            scanTask.cancel(false);
            scanTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Builder for {@link RetryScheduler}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private WebhookStore store;
        private DeliveryQueue queue;
        private int batchSize = 100;
        private long intervalMs = 30_000;
        private MetricsExporter metrics;
        private JsonCodec jsonCodec;

        private Builder() {
        }

        /**
         * Sets the connection provider used for scans and claims.
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
         * Sets the store holding delivery history.
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
         * Sets the queue receiving follow-up attempts.
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
         * Sets the maximum number of due rows handled per cycle.
         *
         * <p>Optional. Defaults to {@code 100}. Must be &gt; 0.
         *
         * @param batchSize rows per cycle
         * @return this builder
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Sets the delay between the end of one cycle and the start of the next.
         *
         * <p>Optional. Defaults to {@code 30000} ms. Must be &gt; 0.
         *
         * @param intervalMs scan interval in milliseconds
         * @return this builder
         */
        public Builder intervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
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
         * Sets the codec used to decode stored envelopes.
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
         * Builds the scheduler. Call {@link RetryScheduler#start()} to begin scanning.
         *
         * @return a new {@link RetryScheduler}
         * @throws NullPointerException     if {@code connectionProvider}, {@code store} or
         *                                  {@code queue} is null
         * @throws IllegalArgumentException if {@code batchSize <= 0} or {@code intervalMs <= 0}
         */
        public RetryScheduler build() {
            return new RetryScheduler(this);
        }
    }
}
