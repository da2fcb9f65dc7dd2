package hookrelay.delivery;

import okhttp3.Call;
import okhttp3.Headers;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * {@link WebhookTransport} on OkHttp.
 *
 * <p>The per-request timeout bounds the whole call: connecting, writing the request,
 * waiting for headers and reading the body. A timeout surfaces as
 * {@link java.io.InterruptedIOException}. Requests use HTTP/1.1 and redirects are
 * not followed, so a 3xx answer counts as a failed attempt. At most
 * {@code maxResponseBytes} of the response body are read. Response header names are
 * lower-cased.
 */
public final class OkHttpWebhookTransport implements WebhookTransport {
  private static final Logger logger = Logger.getLogger(OkHttpWebhookTransport.class.getName());

  // Framing and routing headers are owned by the client
  private static final Set<String> CLIENT_MANAGED_HEADERS =
      Set.of("connection", "content-length", "expect", "host", "transfer-encoding", "upgrade");

  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);
  public static final long DEFAULT_MAX_RESPONSE_BYTES = 64 * 1024;

  private final OkHttpClient client;
  private final long maxResponseBytes;

  public OkHttpWebhookTransport() {
    this(DEFAULT_CONNECT_TIMEOUT, DEFAULT_MAX_RESPONSE_BYTES);
  }

  public OkHttpWebhookTransport(Duration connectTimeout, long maxResponseBytes) {
    this(new OkHttpClient.Builder()
        .protocols(List.of(Protocol.HTTP_1_1))
        .connectTimeout(connectTimeout)
        .followRedirects(false)
        .followSslRedirects(false)
        .retryOnConnectionFailure(false)
        .build(), maxResponseBytes);
  }

  /**
   * @param client           base client; redirect and protocol settings are taken as given
   * @param maxResponseBytes response body bytes read before the rest is discarded
   */
  public OkHttpWebhookTransport(OkHttpClient client, long maxResponseBytes) {
    this.client = Objects.requireNonNull(client, "client");
    if (maxResponseBytes < 0) {
      throw new IllegalArgumentException("maxResponseBytes must be >= 0");
    }
    this.maxResponseBytes = maxResponseBytes;
  }

  @Override
  public TransportResponse send(String url, Map<String, String> headers, byte[] body, Duration timeout)
      throws IOException {
    Request request;
    try {
      Request.Builder builder = new Request.Builder()
          .url(url)
          .post(RequestBody.create(body, null));
      for (Map.Entry<String, String> header : headers.entrySet()) {
        if (CLIENT_MANAGED_HEADERS.contains(header.getKey().toLowerCase(Locale.ROOT))) {
          logger.fine("Skipping client-managed header " + header.getKey());
          continue;
        }
        builder.header(header.getKey(), header.getValue());
      }
      request = builder.build();
    } catch (IllegalArgumentException | IllegalStateException e) {
      throw new IOException("Invalid webhook request for " + url + ": " + e.getMessage(), e);
    }

    Call call = client.newCall(request);
    call.timeout().timeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
    try (Response response = call.execute()) {
      return new TransportResponse(response.code(), readCapped(response.body()), lowerCased(response.headers()));
    }
  }

  private String readCapped(ResponseBody body) throws IOException {
    if (body == null) {
      return null;
    }
    BufferedSource source = body.source();
    source.request(maxResponseBytes);
    long available = Math.min(maxResponseBytes, source.getBuffer().size());
    return new String(source.getBuffer().readByteArray(available), StandardCharsets.UTF_8);
  }

  private static Map<String, String> lowerCased(Headers headers) {
    Map<String, String> result = new LinkedHashMap<>();
    for (int i = 0; i < headers.size(); i++) {
      result.putIfAbsent(headers.name(i).toLowerCase(Locale.ROOT), headers.value(i));
    }
    return result;
  }
}
