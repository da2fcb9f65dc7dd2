package hookrelay.jdbc.store;

import hookrelay.jdbc.JdbcTemplate;
import hookrelay.jdbc.TableNames;
import hookrelay.model.DeliveryUpdate;
import hookrelay.model.NewDelivery;
import hookrelay.model.Webhook;
import hookrelay.model.WebhookDelivery;
import hookrelay.model.WebhookUpdate;
import hookrelay.spi.WebhookStore;
import hookrelay.util.JsonCodec;
import hookrelay.util.PayloadSerializationException;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base JDBC webhook store with standard SQL implementations.
 *
 * <p>Three tables are used: webhook registrations, their event-type subscriptions
 * (one row per webhook and event type) and delivery history. Table names default
 * to {@link TableNames} and can be changed with {@link #withTables}.
 *
 * <p>Subclasses override the placeholder hooks and the statements that benefit from
 * a database-specific form. Register custom implementations via
 * {@code META-INF/services/hookrelay.jdbc.store.AbstractJdbcWebhookStore}.
 *
 * @see JdbcWebhookStores
 */
public abstract class AbstractJdbcWebhookStore implements WebhookStore {
  private static final Logger logger = Logger.getLogger(AbstractJdbcWebhookStore.class.getName());

  protected static final int MAX_ERROR_LENGTH = 4000;

  protected static final String WEBHOOK_COLUMNS =
      "id, uuid, name, url, secret, headers, enabled, failure_count, disabled_reason, " +
      "last_triggered_at, created_at";

  protected static final String DELIVERY_COLUMNS =
      "id, uuid, webhook_id, event_type, payload, request_headers, attempt_number, " +
      "response_status, response_body, duration_ms, error_message, delivered_at, " +
      "next_retry_at, created_at";

  private final String webhooksTable;
  private final String deliveriesTable;
  private final String subscriptionsTable;
  private final JsonCodec jsonCodec;

  protected AbstractJdbcWebhookStore() {
    this(TableNames.DEFAULT_WEBHOOKS_TABLE, TableNames.DEFAULT_DELIVERIES_TABLE,
        TableNames.DEFAULT_SUBSCRIPTIONS_TABLE, JsonCodec.getDefault());
  }

  protected AbstractJdbcWebhookStore(String webhooksTable, String deliveriesTable,
      String subscriptionsTable, JsonCodec jsonCodec) {
    this.webhooksTable = TableNames.validate(webhooksTable);
    this.deliveriesTable = TableNames.validate(deliveriesTable);
    this.subscriptionsTable = TableNames.validate(subscriptionsTable);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  /**
   * Unique identifier for this webhook store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this webhook store handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Creates a store of the same dialect with the given tables and codec.
   */
  protected abstract AbstractJdbcWebhookStore newInstance(String webhooksTable, String deliveriesTable,
      String subscriptionsTable, JsonCodec jsonCodec);

  /**
   * Returns a copy of this store that uses the given table names.
   *
   * @throws IllegalArgumentException if a name is not a plain SQL identifier
   */
  public AbstractJdbcWebhookStore withTables(String webhooksTable, String deliveriesTable,
      String subscriptionsTable) {
    return newInstance(webhooksTable, deliveriesTable, subscriptionsTable, jsonCodec);
  }

  /**
   * Returns a copy of this store that encodes header maps with {@code jsonCodec}.
   */
  public AbstractJdbcWebhookStore withJsonCodec(JsonCodec jsonCodec) {
    return newInstance(webhooksTable, deliveriesTable, subscriptionsTable, jsonCodec);
  }

  public String webhooksTable() {
    return webhooksTable;
  }

  public String deliveriesTable() {
    return deliveriesTable;
  }

  public String subscriptionsTable() {
    return subscriptionsTable;
  }

  protected JsonCodec jsonCodec() {
    return jsonCodec;
  }

  /** Placeholder for a JSON-typed parameter. */
  protected String jsonParam() {
    return "?";
  }

  /** Placeholder for a UUID-typed parameter. */
  protected String uuidParam() {
    return "?";
  }

  // ── Webhooks ──────────────────────────────────────────────────

  @Override
  public List<Webhook> findWebhooksForEvent(Connection conn, String eventType) throws SQLException {
    String sql = "SELECT " + qualified("w", WEBHOOK_COLUMNS) +
        " FROM " + webhooksTable + " w JOIN " + subscriptionsTable + " s ON s.webhook_id = w.id" +
        " WHERE w.enabled = TRUE AND s.event_type = ? ORDER BY w.id";
    List<WebhookRow> rows = JdbcTemplate.query(conn, sql, this::mapWebhookRow, eventType);
    return withEvents(conn, rows);
  }

  @Override
  public Optional<Webhook> findWebhook(Connection conn, long webhookId) throws SQLException {
    String sql = "SELECT " + WEBHOOK_COLUMNS + " FROM " + webhooksTable + " WHERE id = ?";
    List<WebhookRow> rows = JdbcTemplate.query(conn, sql, this::mapWebhookRow, webhookId);
    return withEvents(conn, rows).stream().findFirst();
  }

  @Override
  public int updateWebhook(Connection conn, long webhookId, WebhookUpdate update) throws SQLException {
    if (update.isEmpty()) {
      return 0;
    }
    SetClause set = new SetClause();
    if (update.hasEnabled()) set.add("enabled = ?", update.enabled());
    if (update.hasFailureCount()) set.add("failure_count = ?", update.failureCount());
    if (update.hasDisabledReason()) set.add("disabled_reason = ?", update.disabledReason());
    if (update.hasLastTriggeredAt()) set.add("last_triggered_at = ?", update.lastTriggeredAt());
    set.add("updated_at = ?", Instant.now());
    return JdbcTemplate.update(conn,
        "UPDATE " + webhooksTable + " SET " + set.sql() + " WHERE id = ?", set.params(webhookId));
  }

  /**
   * {@inheritDoc}
   *
   * <p>{@code failure_count} is assigned last: MySQL evaluates later assignments
   * against already-updated columns, standard SQL against the old row.
   */
  @Override
  public int incrementFailureCount(Connection conn, long webhookId, int disableThreshold)
      throws SQLException {
    int updated = JdbcTemplate.update(conn, incrementFailureCountSql(),
        disableThreshold, disableThreshold, Instant.now(), webhookId);
    if (updated == 0) {
      return -1;
    }
    String sql = "SELECT failure_count FROM " + webhooksTable + " WHERE id = ?";
    List<Integer> counts = JdbcTemplate.query(conn, sql, rs -> rs.getInt(1), webhookId);
    return counts.isEmpty() ? -1 : counts.get(0);
  }

  protected String incrementFailureCountSql() {
    return "UPDATE " + webhooksTable + " SET" +
        " enabled = CASE WHEN failure_count + 1 >= ? THEN FALSE ELSE enabled END," +
        " disabled_reason = CASE WHEN failure_count + 1 >= ?" +
        " THEN CONCAT('Auto-disabled after ', failure_count + 1, ' consecutive failures')" +
        " ELSE disabled_reason END," +
        " updated_at = ?," +
        " failure_count = failure_count + 1" +
        " WHERE id = ?";
  }

  // ── Deliveries ────────────────────────────────────────────────

  @Override
  public long createDelivery(Connection conn, NewDelivery delivery) throws SQLException {
    return JdbcTemplate.insert(conn, insertDeliverySql(), insertDeliveryParams(delivery));
  }

  protected String insertDeliverySql() {
    return "INSERT INTO " + deliveriesTable +
        " (uuid, webhook_id, event_type, payload, request_headers, attempt_number, created_at)" +
        " VALUES (" + uuidParam() + ", ?, ?, " + jsonParam() + ", " + jsonParam() + ", ?, ?)";
  }

  protected Object[] insertDeliveryParams(NewDelivery delivery) {
    return new Object[] {
        delivery.uuid().toString(), delivery.webhookId(), delivery.eventType(),
        delivery.payloadJson(), jsonCodec.toJson(delivery.requestHeaders()),
        delivery.attemptNumber(), Instant.now()};
  }

  @Override
  public int updateDelivery(Connection conn, long deliveryId, DeliveryUpdate update) throws SQLException {
    if (update.isEmpty()) {
      return 0;
    }
    SetClause set = new SetClause();
    if (update.hasResponseStatus()) set.add("response_status = ?", update.responseStatus());
    if (update.hasResponseBody()) set.add("response_body = ?", update.responseBody());
    if (update.hasResponseHeaders()) {
      set.add("response_headers = " + jsonParam(), jsonCodec.toJson(update.responseHeaders()));
    }
    if (update.hasDurationMs()) set.add("duration_ms = ?", update.durationMs());
    if (update.hasErrorMessage()) set.add("error_message = ?", truncateError(update.errorMessage()));
    if (update.hasDeliveredAt()) set.add("delivered_at = ?", update.deliveredAt());
    if (update.hasNextRetryAt()) set.add("next_retry_at = ?", update.nextRetryAt());
    return JdbcTemplate.update(conn,
        "UPDATE " + deliveriesTable + " SET " + set.sql() + " WHERE id = ?", set.params(deliveryId));
  }

  @Override
  public List<WebhookDelivery> findPendingRetries(Connection conn, Instant now, int limit)
      throws SQLException {
    String sql = "SELECT " + DELIVERY_COLUMNS + " FROM " + deliveriesTable +
        " WHERE delivered_at IS NULL AND next_retry_at IS NOT NULL AND next_retry_at <= ?" +
        " ORDER BY next_retry_at, id LIMIT ?";
    return JdbcTemplate.query(conn, sql, this::mapDelivery, now, limit);
  }

  @Override
  public boolean claimRetry(Connection conn, long deliveryId, Instant now) throws SQLException {
    String sql = "UPDATE " + deliveriesTable + " SET next_retry_at = NULL" +
        " WHERE id = ? AND delivered_at IS NULL AND next_retry_at IS NOT NULL AND next_retry_at <= ?";
    return JdbcTemplate.update(conn, sql, deliveryId, now) == 1;
  }

  @Override
  public Optional<WebhookDelivery> findDelivery(Connection conn, long deliveryId) throws SQLException {
    String sql = "SELECT " + DELIVERY_COLUMNS + " FROM " + deliveriesTable + " WHERE id = ?";
    return JdbcTemplate.query(conn, sql, this::mapDelivery, deliveryId).stream().findFirst();
  }

  @Override
  public List<WebhookDelivery> findDeliveries(Connection conn, long webhookId, int limit, int offset)
      throws SQLException {
    String sql = "SELECT " + DELIVERY_COLUMNS + " FROM " + deliveriesTable +
        " WHERE webhook_id = ? ORDER BY created_at DESC, id DESC LIMIT ? OFFSET ?";
    return JdbcTemplate.query(conn, sql, this::mapDelivery, webhookId, limit, offset);
  }

  // ── Row mapping ───────────────────────────────────────────────

  protected WebhookDelivery mapDelivery(ResultSet rs) throws SQLException {
    return new WebhookDelivery(
        rs.getLong("id"),
        UUID.fromString(rs.getString("uuid")),
        rs.getLong("webhook_id"),
        rs.getString("event_type"),
        rs.getString("payload"),
        jsonCodec.parseObject(rs.getString("request_headers")),
        rs.getInt("attempt_number"),
        JdbcTemplate.getInteger(rs, "response_status"),
        rs.getString("response_body"),
        JdbcTemplate.getLong(rs, "duration_ms"),
        rs.getString("error_message"),
        JdbcTemplate.getInstant(rs, "delivered_at"),
        JdbcTemplate.getInstant(rs, "next_retry_at"),
        JdbcTemplate.getInstant(rs, "created_at"));
  }

  private WebhookRow mapWebhookRow(ResultSet rs) throws SQLException {
    return new WebhookRow(
        rs.getLong("id"),
        UUID.fromString(rs.getString("uuid")),
        rs.getString("name"),
        rs.getString("url"),
        rs.getString("secret"),
        customHeaders(rs.getLong("id"), rs.getString("headers")),
        rs.getBoolean("enabled"),
        rs.getInt("failure_count"),
        rs.getString("disabled_reason"),
        JdbcTemplate.getInstant(rs, "last_triggered_at"),
        JdbcTemplate.getInstant(rs, "created_at"));
  }

  /** Unreadable custom headers must not hide the webhook from lookups. */
  private Map<String, String> customHeaders(long webhookId, String json) {
    try {
      return jsonCodec.parseObject(json);
    } catch (PayloadSerializationException e) {
      logger.log(Level.WARNING, "Ignoring malformed custom headers of webhook " + webhookId, e);
      return Map.of();
    }
  }

  private List<Webhook> withEvents(Connection conn, List<WebhookRow> rows) {
    if (rows.isEmpty()) {
      return List.of();
    }
    Map<Long, Set<String>> events = new LinkedHashMap<>();
    List<Object> ids = new ArrayList<>(rows.size());
    for (WebhookRow row : rows) {
      events.put(row.id(), new HashSet<>());
      ids.add(row.id());
    }
    String sql = "SELECT webhook_id, event_type FROM " + subscriptionsTable +
        " WHERE webhook_id IN (" + String.join(",", Collections.nCopies(ids.size(), "?")) + ")";
    JdbcTemplate.query(conn, sql, rs -> events.get(rs.getLong(1)).add(rs.getString(2)), ids.toArray());

    List<Webhook> webhooks = new ArrayList<>(rows.size());
    for (WebhookRow row : rows) {
      webhooks.add(row.toWebhook(events.get(row.id())));
    }
    return webhooks;
  }

  protected static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }

  private static String qualified(String alias, String columns) {
    StringBuilder sb = new StringBuilder();
    for (String column : columns.split(",")) {
      if (sb.length() > 0) {
        sb.append(", ");
      }
      sb.append(alias).append('.').append(column.trim());
    }
    return sb.toString();
  }

  private record WebhookRow(long id, UUID uuid, String name, String url, String secret,
      Map<String, String> headers, boolean enabled, int failureCount, String disabledReason,
      Instant lastTriggeredAt, Instant createdAt) {

    Webhook toWebhook(Set<String> events) {
      return new Webhook(id, uuid, name, url, secret, events, headers, enabled, failureCount,
          disabledReason, lastTriggeredAt, createdAt);
    }
  }

  private static final class SetClause {
    private final List<String> assignments = new ArrayList<>();
    private final List<Object> params = new ArrayList<>();

    void add(String assignment, Object param) {
      assignments.add(assignment);
      params.add(param);
    }

    String sql() {
      return String.join(", ", assignments);
    }

    Object[] params(Object id) {
      List<Object> all = new ArrayList<>(params);
      all.add(id);
      return all.toArray();
    }
  }
}
