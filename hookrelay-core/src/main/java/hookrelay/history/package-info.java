/**
 * Queries over recorded delivery attempts.
 */
package hookrelay.history;
