package hookrelay.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the webhook relay.
 *
 * @see WebhookRelayAutoConfiguration
 */
@ConfigurationProperties(prefix = "hookrelay")
public class WebhookRelayProperties {

    /**
     * Whether the relay is auto-configured at all.
     */
    private boolean enabled = true;

    /**
     * Product name used in the {@code X-<name>-*} request headers and the User-Agent.
     */
    private String productName = "Hookrelay";

    private String webhooksTable = "webhooks";
    private String deliveriesTable = "webhook_deliveries";
    private String subscriptionsTable = "webhook_subscriptions";

    /**
     * Maximum time to wait for queued deliveries when the relay shuts down.
     */
    private Duration drainTimeout = Duration.ofSeconds(5);

    private final Queue queue = new Queue();
    private final Delivery delivery = new Delivery();
    private final Retry retry = new Retry();
    private final EventSource eventSource = new EventSource();
    private final Metrics metrics = new Metrics();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getProductName() {
        return productName;
    }

    public void setProductName(String productName) {
        this.productName = productName;
    }

    public String getWebhooksTable() {
        return webhooksTable;
    }

    public void setWebhooksTable(String webhooksTable) {
        this.webhooksTable = webhooksTable;
    }

    public String getDeliveriesTable() {
        return deliveriesTable;
    }

    public void setDeliveriesTable(String deliveriesTable) {
        this.deliveriesTable = deliveriesTable;
    }

    public String getSubscriptionsTable() {
        return subscriptionsTable;
    }

    public void setSubscriptionsTable(String subscriptionsTable) {
        this.subscriptionsTable = subscriptionsTable;
    }

    public Duration getDrainTimeout() {
        return drainTimeout;
    }

    public void setDrainTimeout(Duration drainTimeout) {
        this.drainTimeout = drainTimeout;
    }

    public Queue getQueue() {
        return queue;
    }

    public Delivery getDelivery() {
        return delivery;
    }

    public Retry getRetry() {
        return retry;
    }

    public EventSource getEventSource() {
        return eventSource;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Queue {
        private int capacity = 1000;

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }
    }

    public static class Delivery {
        private int maxAttempts = 5;
        private int autoDisableThreshold = 10;
        private Duration requestTimeout = Duration.ofSeconds(30);
        private int responseBodyLimit = 4096;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public int getAutoDisableThreshold() {
            return autoDisableThreshold;
        }

        public void setAutoDisableThreshold(int autoDisableThreshold) {
            this.autoDisableThreshold = autoDisableThreshold;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }

        public int getResponseBodyLimit() {
            return responseBodyLimit;
        }

        public void setResponseBodyLimit(int responseBodyLimit) {
            this.responseBodyLimit = responseBodyLimit;
        }
    }

    public static class Retry {
        /**
         * Whether this instance runs the retry scan. Turn off on instances that only deliver.
         */
        private boolean enabled = true;
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofHours(1);
        private Duration interval = Duration.ofSeconds(30);
        private int batchSize = 100;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class EventSource {
        /**
         * Per-subscriber buffer of the broadcast event source. Older events are dropped when it is full.
         */
        private int bufferSize = 1024;

        public int getBufferSize() {
            return bufferSize;
        }

        public void setBufferSize(int bufferSize) {
            this.bufferSize = bufferSize;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "hookrelay";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
