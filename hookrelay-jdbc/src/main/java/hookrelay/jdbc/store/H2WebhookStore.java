package hookrelay.jdbc.store;

import hookrelay.util.JsonCodec;

import java.util.List;

/**
 * H2 webhook store. Primarily for testing.
 *
 * <p>Uses the standard SQL from {@link AbstractJdbcWebhookStore} unchanged.
 */
public final class H2WebhookStore extends AbstractJdbcWebhookStore {

  public H2WebhookStore() {
    super();
  }

  public H2WebhookStore(String webhooksTable, String deliveriesTable, String subscriptionsTable,
      JsonCodec jsonCodec) {
    super(webhooksTable, deliveriesTable, subscriptionsTable, jsonCodec);
  }

  @Override
  protected AbstractJdbcWebhookStore newInstance(String webhooksTable, String deliveriesTable,
      String subscriptionsTable, JsonCodec jsonCodec) {
    return new H2WebhookStore(webhooksTable, deliveriesTable, subscriptionsTable, jsonCodec);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
