package hookrelay.delivery;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * Sends one signed webhook request.
 *
 * @see OkHttpWebhookTransport
 */
@FunctionalInterface
public interface WebhookTransport {

  /**
   * POSTs {@code body} to {@code url}.
   *
   * @param url     endpoint URL
   * @param headers request headers, already filtered
   * @param body    exact body bytes that were signed
   * @param timeout overall request timeout
   * @return the response, whatever its status
   * @throws IOException          if no HTTP response was obtained (connect error, timeout, bad URL)
   * @throws InterruptedException if the calling thread is interrupted
   */
  TransportResponse send(String url, Map<String, String> headers, byte[] body, Duration timeout)
      throws IOException, InterruptedException;
}
