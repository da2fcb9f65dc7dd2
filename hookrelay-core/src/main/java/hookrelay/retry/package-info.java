/**
 * Scheduled hand-off of due retries back to the delivery queue.
 */
package hookrelay.retry;
