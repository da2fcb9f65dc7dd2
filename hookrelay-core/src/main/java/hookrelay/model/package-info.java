/**
 * Webhook registrations, delivery rows, and the partial updates applied to them.
 */
package hookrelay.model;
