/**
 * Request signing. Receivers verify {@code X-<Product>-Signature} with
 * {@link hookrelay.signature.WebhookSignatures#verify(byte[], String, String)}.
 */
package hookrelay.signature;
