/**
 * Outbound webhook delivery.
 *
 * <p>{@link hookrelay.WebhookRelay} composes the pieces: a
 * {@link hookrelay.listener.WebhookEventListener} turns domain events into delivery
 * tasks, a single {@link hookrelay.delivery.DeliveryWorker} signs, sends and records
 * each attempt, and a {@link hookrelay.retry.RetryScheduler} feeds scheduled retries
 * back into the {@link hookrelay.delivery.DeliveryQueue}.
 *
 * <p>Persistence is delegated to a {@link hookrelay.spi.WebhookStore}; the JDBC
 * implementations live in the {@code hookrelay-jdbc} module.
 */
package hookrelay;
