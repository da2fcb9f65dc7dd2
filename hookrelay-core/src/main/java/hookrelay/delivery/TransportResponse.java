package hookrelay.delivery;

import java.util.Map;

/**
 * An HTTP response as seen by the delivery worker.
 *
 * @param status  HTTP status code
 * @param body    response body decoded as UTF-8, may be {@code null}
 * @param headers response headers, first value per name
 */
public record TransportResponse(int status, String body, Map<String, String> headers) {

  public TransportResponse {
    headers = headers == null ? Map.of() : Map.copyOf(headers);
  }

  public boolean isSuccess() {
    return status >= 200 && status < 300;
  }
}
