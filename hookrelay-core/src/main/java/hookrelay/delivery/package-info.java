/**
 * The delivery pipeline: the bounded {@link hookrelay.delivery.DeliveryQueue}, the
 * single {@link hookrelay.delivery.DeliveryWorker} that drains it, the HTTP
 * transport and the backoff policy for retries.
 */
package hookrelay.delivery;
