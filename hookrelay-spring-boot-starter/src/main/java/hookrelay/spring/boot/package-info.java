/**
 * Spring Boot auto-configuration for the webhook relay.
 *
 * <p>Add the starter next to a {@link javax.sql.DataSource} and publish
 * {@link hookrelay.event.DomainEvent}s with Spring's
 * {@link org.springframework.context.ApplicationEventPublisher}; enabled webhooks
 * subscribed to the mapped event type receive signed deliveries. Settings live
 * under the {@code hookrelay} prefix.
 *
 * @see hookrelay.spring.boot.WebhookRelayAutoConfiguration
 * @see hookrelay.spring.boot.WebhookRelayProperties
 */
package hookrelay.spring.boot;
