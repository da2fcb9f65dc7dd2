/**
 * Subscription of the relay to domain events.
 */
package hookrelay.listener;
