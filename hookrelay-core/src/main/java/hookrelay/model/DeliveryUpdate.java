package hookrelay.model;

import java.time.Instant;
import java.util.Map;

/**
 * Partial update of a delivery row.
 *
 * <p>Each field is either left unchanged or set, where "set" may mean set to
 * {@code null}. Build instances via {@link #builder()}.
 */
public final class DeliveryUpdate {
  private final Integer responseStatus;
  private final String responseBody;
  private final Map<String, String> responseHeaders;
  private final Long durationMs;
  private final String errorMessage;
  private final Instant deliveredAt;
  private final Instant nextRetryAt;
  private final boolean responseStatusSet;
  private final boolean responseBodySet;
  private final boolean responseHeadersSet;
  private final boolean durationMsSet;
  private final boolean errorMessageSet;
  private final boolean deliveredAtSet;
  private final boolean nextRetryAtSet;

  private DeliveryUpdate(Builder builder) {
    this.responseStatus = builder.responseStatus;
    this.responseBody = builder.responseBody;
    this.responseHeaders = builder.responseHeaders == null ? null : Map.copyOf(builder.responseHeaders);
    this.durationMs = builder.durationMs;
    this.errorMessage = builder.errorMessage;
    this.deliveredAt = builder.deliveredAt;
    this.nextRetryAt = builder.nextRetryAt;
    this.responseStatusSet = builder.responseStatusSet;
    this.responseBodySet = builder.responseBodySet;
    this.responseHeadersSet = builder.responseHeadersSet;
    this.durationMsSet = builder.durationMsSet;
    this.errorMessageSet = builder.errorMessageSet;
    this.deliveredAtSet = builder.deliveredAtSet;
    this.nextRetryAtSet = builder.nextRetryAtSet;
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean isEmpty() {
    return !(responseStatusSet || responseBodySet || responseHeadersSet || durationMsSet
        || errorMessageSet || deliveredAtSet || nextRetryAtSet);
  }

  public Integer responseStatus() { return responseStatus; }
  public String responseBody() { return responseBody; }
  public Map<String, String> responseHeaders() { return responseHeaders; }
  public Long durationMs() { return durationMs; }
  public String errorMessage() { return errorMessage; }
  public Instant deliveredAt() { return deliveredAt; }
  public Instant nextRetryAt() { return nextRetryAt; }

  public boolean hasResponseStatus() { return responseStatusSet; }
  public boolean hasResponseBody() { return responseBodySet; }
  public boolean hasResponseHeaders() { return responseHeadersSet; }
  public boolean hasDurationMs() { return durationMsSet; }
  public boolean hasErrorMessage() { return errorMessageSet; }
  public boolean hasDeliveredAt() { return deliveredAtSet; }
  public boolean hasNextRetryAt() { return nextRetryAtSet; }

  /** Builder for {@link DeliveryUpdate}. Only called setters are applied. */
  public static final class Builder {
    private Integer responseStatus;
    private String responseBody;
    private Map<String, String> responseHeaders;
    private Long durationMs;
    private String errorMessage;
    private Instant deliveredAt;
    private Instant nextRetryAt;
    private boolean responseStatusSet;
    private boolean responseBodySet;
    private boolean responseHeadersSet;
    private boolean durationMsSet;
    private boolean errorMessageSet;
    private boolean deliveredAtSet;
    private boolean nextRetryAtSet;

    private Builder() {}

    public Builder responseStatus(Integer responseStatus) {
      this.responseStatus = responseStatus;
      this.responseStatusSet = true;
      return this;
    }

    public Builder responseBody(String responseBody) {
      this.responseBody = responseBody;
      this.responseBodySet = true;
      return this;
    }

    public Builder responseHeaders(Map<String, String> responseHeaders) {
      this.responseHeaders = responseHeaders;
      this.responseHeadersSet = true;
      return this;
    }

    public Builder durationMs(Long durationMs) {
      this.durationMs = durationMs;
      this.durationMsSet = true;
      return this;
    }

    public Builder errorMessage(String errorMessage) {
      this.errorMessage = errorMessage;
      this.errorMessageSet = true;
      return this;
    }

    public Builder deliveredAt(Instant deliveredAt) {
      this.deliveredAt = deliveredAt;
      this.deliveredAtSet = true;
      return this;
    }

    public Builder nextRetryAt(Instant nextRetryAt) {
      this.nextRetryAt = nextRetryAt;
      this.nextRetryAtSet = true;
      return this;
    }

    public DeliveryUpdate build() {
      return new DeliveryUpdate(this);
    }
  }
}
