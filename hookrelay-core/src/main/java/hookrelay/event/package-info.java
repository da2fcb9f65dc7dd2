/**
 * Domain events and the in-process broadcast source that fans them out.
 */
package hookrelay.event;
