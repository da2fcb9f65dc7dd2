package hookrelay.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebhookRelayPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(WebhookRelayProperties.class);
            assertTrue(props.isEnabled());
            assertEquals("Hookrelay", props.getProductName());
            assertEquals("webhooks", props.getWebhooksTable());
            assertEquals("webhook_deliveries", props.getDeliveriesTable());
            assertEquals("webhook_subscriptions", props.getSubscriptionsTable());
            assertEquals(Duration.ofSeconds(5), props.getDrainTimeout());
            assertEquals(1000, props.getQueue().getCapacity());
            assertEquals(5, props.getDelivery().getMaxAttempts());
            assertEquals(10, props.getDelivery().getAutoDisableThreshold());
            assertEquals(Duration.ofSeconds(30), props.getDelivery().getRequestTimeout());
            assertEquals(4096, props.getDelivery().getResponseBodyLimit());
            assertTrue(props.getRetry().isEnabled());
            assertEquals(Duration.ofSeconds(1), props.getRetry().getInitialDelay());
            assertEquals(Duration.ofHours(1), props.getRetry().getMaxDelay());
            assertEquals(Duration.ofSeconds(30), props.getRetry().getInterval());
            assertEquals(100, props.getRetry().getBatchSize());
            assertEquals(1024, props.getEventSource().getBufferSize());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("hookrelay", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "hookrelay.product-name=Acme",
                "hookrelay.drain-timeout=10s",
                "hookrelay.queue.capacity=50",
                "hookrelay.delivery.max-attempts=3",
                "hookrelay.delivery.auto-disable-threshold=4",
                "hookrelay.delivery.request-timeout=2s",
                "hookrelay.delivery.response-body-limit=128",
                "hookrelay.retry.enabled=false",
                "hookrelay.retry.initial-delay=500ms",
                "hookrelay.retry.max-delay=10m",
                "hookrelay.retry.interval=1m",
                "hookrelay.retry.batch-size=20",
                "hookrelay.event-source.buffer-size=16",
                "hookrelay.metrics.enabled=false",
                "hookrelay.metrics.name-prefix=acme"
        ).run(ctx -> {
            var props = ctx.getBean(WebhookRelayProperties.class);
            assertEquals("Acme", props.getProductName());
            assertEquals(Duration.ofSeconds(10), props.getDrainTimeout());
            assertEquals(50, props.getQueue().getCapacity());
            assertEquals(3, props.getDelivery().getMaxAttempts());
            assertEquals(4, props.getDelivery().getAutoDisableThreshold());
            assertEquals(Duration.ofSeconds(2), props.getDelivery().getRequestTimeout());
            assertEquals(128, props.getDelivery().getResponseBodyLimit());
            assertFalse(props.getRetry().isEnabled());
            assertEquals(Duration.ofMillis(500), props.getRetry().getInitialDelay());
            assertEquals(Duration.ofMinutes(10), props.getRetry().getMaxDelay());
            assertEquals(Duration.ofMinutes(1), props.getRetry().getInterval());
            assertEquals(20, props.getRetry().getBatchSize());
            assertEquals(16, props.getEventSource().getBufferSize());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("acme", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(WebhookRelayProperties.class)
    static class PropsConfig {
    }
}
