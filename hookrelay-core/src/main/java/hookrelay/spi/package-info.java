/**
 * Service provider interfaces: persistence, connection supply, the domain event
 * source, and metrics export.
 */
package hookrelay.spi;
