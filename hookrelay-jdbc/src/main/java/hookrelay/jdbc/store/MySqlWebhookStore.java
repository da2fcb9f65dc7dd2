package hookrelay.jdbc.store;

import hookrelay.util.JsonCodec;

import java.util.List;

/**
 * MySQL webhook store. Also handles MariaDB and TiDB URLs.
 *
 * <p>JSON columns accept plain string parameters, so the standard SQL applies.
 */
public final class MySqlWebhookStore extends AbstractJdbcWebhookStore {

  public MySqlWebhookStore() {
    super();
  }

  public MySqlWebhookStore(String webhooksTable, String deliveriesTable, String subscriptionsTable,
      JsonCodec jsonCodec) {
    super(webhooksTable, deliveriesTable, subscriptionsTable, jsonCodec);
  }

  @Override
  protected AbstractJdbcWebhookStore newInstance(String webhooksTable, String deliveriesTable,
      String subscriptionsTable, JsonCodec jsonCodec) {
    return new MySqlWebhookStore(webhooksTable, deliveriesTable, subscriptionsTable, jsonCodec);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:", "jdbc:tidb:");
  }
}
