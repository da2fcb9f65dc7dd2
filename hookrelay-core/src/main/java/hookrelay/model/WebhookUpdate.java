package hookrelay.model;

import java.time.Instant;

/**
 * Partial update of a webhook's health fields.
 *
 * <p>Fields not set on the builder are left unchanged; a field set to {@code null}
 * is written as {@code NULL}.
 */
public final class WebhookUpdate {
  private final Boolean enabled;
  private final Integer failureCount;
  private final String disabledReason;
  private final Instant lastTriggeredAt;
  private final boolean enabledSet;
  private final boolean failureCountSet;
  private final boolean disabledReasonSet;
  private final boolean lastTriggeredAtSet;

  private WebhookUpdate(Builder builder) {
    this.enabled = builder.enabled;
    this.failureCount = builder.failureCount;
    this.disabledReason = builder.disabledReason;
    this.lastTriggeredAt = builder.lastTriggeredAt;
    this.enabledSet = builder.enabledSet;
    this.failureCountSet = builder.failureCountSet;
    this.disabledReasonSet = builder.disabledReasonSet;
    this.lastTriggeredAtSet = builder.lastTriggeredAtSet;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * The update applied after a successful attempt: marks the trigger time and
   * clears the failure streak.
   *
   * @param at time of the successful attempt
   * @return the update
   */
  public static WebhookUpdate succeeded(Instant at) {
    return builder().lastTriggeredAt(at).failureCount(0).disabledReason(null).build();
  }

  public boolean isEmpty() {
    return !(enabledSet || failureCountSet || disabledReasonSet || lastTriggeredAtSet);
  }

  public Boolean enabled() { return enabled; }
  public Integer failureCount() { return failureCount; }
  public String disabledReason() { return disabledReason; }
  public Instant lastTriggeredAt() { return lastTriggeredAt; }

  public boolean hasEnabled() { return enabledSet; }
  public boolean hasFailureCount() { return failureCountSet; }
  public boolean hasDisabledReason() { return disabledReasonSet; }
  public boolean hasLastTriggeredAt() { return lastTriggeredAtSet; }

  /** Builder for {@link WebhookUpdate}. */
  public static final class Builder {
    private Boolean enabled;
    private Integer failureCount;
    private String disabledReason;
    private Instant lastTriggeredAt;
    private boolean enabledSet;
    private boolean failureCountSet;
    private boolean disabledReasonSet;
    private boolean lastTriggeredAtSet;

    private Builder() {}

    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      this.enabledSet = true;
      return this;
    }

    public Builder failureCount(int failureCount) {
      if (failureCount < 0) {
        throw new IllegalArgumentException("failureCount must be >= 0");
      }
      this.failureCount = failureCount;
      this.failureCountSet = true;
      return this;
    }

    public Builder disabledReason(String disabledReason) {
      this.disabledReason = disabledReason;
      this.disabledReasonSet = true;
      return this;
    }

    public Builder lastTriggeredAt(Instant lastTriggeredAt) {
      this.lastTriggeredAt = lastTriggeredAt;
      this.lastTriggeredAtSet = true;
      return this;
    }

    public WebhookUpdate build() {
      return new WebhookUpdate(this);
    }
  }
}
