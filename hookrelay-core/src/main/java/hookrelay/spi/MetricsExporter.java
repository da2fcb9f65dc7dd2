package hookrelay.spi;

/**
 * Observability hook for exporting delivery counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 *
 * @see hookrelay.micrometer.MicrometerMetricsExporter
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of delivery tasks accepted by the queue.
     */
    void incrementEnqueued();

    /**
     * Increments the count of delivery tasks refused because the queue was closed.
     */
    void incrementEnqueueRejected();

    /**
     * Increments the count of attempts answered with a 2xx status.
     */
    void incrementDeliverySuccess();

    /**
     * Increments the count of failed attempts that scheduled another retry.
     */
    void incrementDeliveryFailure();

    /**
     * Increments the count of failed attempts that ended their chain (no retry left).
     */
    void incrementDeliveryExhausted();

    /**
     * Increments the count of webhooks switched off by the failure threshold.
     */
    void incrementWebhookDisabled();

    /**
     * Increments the count of scheduled retries handed back to the queue.
     */
    void incrementRetryRequeued();

    /**
     * Records domain events the listener missed because it fell behind.
     *
     * @param count number of events skipped (always positive)
     */
    void recordEventsLagged(long count);

    /**
     * Records the current depth of the delivery queue.
     *
     * @param depth number of queued tasks
     */
    void recordQueueDepth(int depth);

    /**
     * Records wall-clock time of one HTTP attempt.
     *
     * @param durationMs attempt duration in milliseconds (always non-negative)
     */
    default void recordDeliveryDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEnqueued() {
        }

        @Override
        public void incrementEnqueueRejected() {
        }

        @Override
        public void incrementDeliverySuccess() {
        }

        @Override
        public void incrementDeliveryFailure() {
        }

        @Override
        public void incrementDeliveryExhausted() {
        }

        @Override
        public void incrementWebhookDisabled() {
        }

        @Override
        public void incrementRetryRequeued() {
        }

        @Override
        public void recordEventsLagged(long count) {
        }

        @Override
        public void recordQueueDepth(int depth) {
        }
    }
}
