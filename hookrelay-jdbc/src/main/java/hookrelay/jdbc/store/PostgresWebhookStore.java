package hookrelay.jdbc.store;

import hookrelay.jdbc.JdbcTemplate;
import hookrelay.model.NewDelivery;
import hookrelay.util.JsonCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

/**
 * PostgreSQL webhook store.
 *
 * <p>Binds UUID and JSONB columns with explicit casts and uses {@code RETURNING}
 * for single-round-trip inserts and failure count increments.
 */
public final class PostgresWebhookStore extends AbstractJdbcWebhookStore {

  public PostgresWebhookStore() {
    super();
  }

  public PostgresWebhookStore(String webhooksTable, String deliveriesTable, String subscriptionsTable,
      JsonCodec jsonCodec) {
    super(webhooksTable, deliveriesTable, subscriptionsTable, jsonCodec);
  }

  @Override
  protected AbstractJdbcWebhookStore newInstance(String webhooksTable, String deliveriesTable,
      String subscriptionsTable, JsonCodec jsonCodec) {
    return new PostgresWebhookStore(webhooksTable, deliveriesTable, subscriptionsTable, jsonCodec);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  protected String jsonParam() {
    return "CAST(? AS JSONB)";
  }

  @Override
  protected String uuidParam() {
    return "CAST(? AS UUID)";
  }

  @Override
  public long createDelivery(Connection conn, NewDelivery delivery) throws SQLException {
    List<Long> ids = JdbcTemplate.updateReturning(conn, insertDeliverySql() + " RETURNING id",
        rs -> rs.getLong(1), insertDeliveryParams(delivery));
    if (ids.isEmpty()) {
      throw new SQLException("Insert into " + deliveriesTable() + " returned no id");
    }
    return ids.get(0);
  }

  @Override
  public int incrementFailureCount(Connection conn, long webhookId, int disableThreshold)
      throws SQLException {
    List<Integer> counts = JdbcTemplate.updateReturning(conn,
        incrementFailureCountSql() + " RETURNING failure_count", rs -> rs.getInt(1),
        disableThreshold, disableThreshold, Instant.now(), webhookId);
    return counts.isEmpty() ? -1 : counts.get(0);
  }
}
