package hookrelay.spi;

import hookrelay.model.DeliveryUpdate;
import hookrelay.model.NewDelivery;
import hookrelay.model.Webhook;
import hookrelay.model.WebhookDelivery;
import hookrelay.model.WebhookUpdate;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence operations for webhook registrations and delivery history.
 *
 * <p>Every method receives a caller-managed {@link Connection}; implementations
 * must not commit, roll back or close it.
 *
 * @see hookrelay.jdbc.store.AbstractJdbcWebhookStore
 */
public interface WebhookStore {

  /**
   * Finds enabled webhooks subscribed to exactly {@code eventType}.
   *
   * @param conn      the JDBC connection
   * @param eventType dotted event type name
   * @return matching webhooks, never {@code null}
   * @throws SQLException on a database error
   */
  List<Webhook> findWebhooksForEvent(Connection conn, String eventType) throws SQLException;

  /**
   * Loads a webhook regardless of its enabled flag.
   *
   * @param conn      the JDBC connection
   * @param webhookId the webhook id
   * @return the webhook, or empty if it does not exist
   * @throws SQLException on a database error
   */
  Optional<Webhook> findWebhook(Connection conn, long webhookId) throws SQLException;

  /**
   * Applies a partial update; fields not set on {@code update} are left unchanged.
   *
   * @param conn      the JDBC connection
   * @param webhookId the webhook id
   * @param update    the fields to change
   * @return number of rows updated (0 or 1)
   * @throws SQLException on a database error
   */
  int updateWebhook(Connection conn, long webhookId, WebhookUpdate update) throws SQLException;

  /**
   * Atomically increments the consecutive failure count. When the new count reaches
   * {@code disableThreshold} the same statement disables the webhook and records the
   * reason {@code "Auto-disabled after N consecutive failures"}.
   *
   * @param conn             the JDBC connection
   * @param webhookId        the webhook id
   * @param disableThreshold failure count that disables the webhook
   * @return the new failure count, or {@code -1} if the webhook does not exist
   * @throws SQLException on a database error
   */
  int incrementFailureCount(Connection conn, long webhookId, int disableThreshold) throws SQLException;

  /**
   * Inserts a delivery row for an attempt about to be sent.
   *
   * @param conn     the JDBC connection
   * @param delivery the attempt
   * @return generated delivery id
   * @throws SQLException on a database error
   */
  long createDelivery(Connection conn, NewDelivery delivery) throws SQLException;

  /**
   * Applies a partial update to a delivery row.
   *
   * @param conn       the JDBC connection
   * @param deliveryId the delivery id
   * @param update     the fields to change
   * @return number of rows updated (0 or 1)
   * @throws SQLException on a database error
   */
  int updateDelivery(Connection conn, long deliveryId, DeliveryUpdate update) throws SQLException;

  /**
   * Finds undelivered rows whose retry is due, oldest due first.
   *
   * @param conn  the JDBC connection
   * @param now   current time
   * @param limit maximum rows to return
   * @return due rows
   * @throws SQLException on a database error
   */
  List<WebhookDelivery> findPendingRetries(Connection conn, Instant now, int limit) throws SQLException;

  /**
   * Claims a due retry by clearing its {@code next_retry_at}. Only one caller can
   * claim a given row.
   *
   * @param conn       the JDBC connection
   * @param deliveryId the delivery id
   * @param now        current time; rows scheduled after it are not claimed
   * @return {@code true} if this call claimed the row
   * @throws SQLException on a database error
   */
  boolean claimRetry(Connection conn, long deliveryId, Instant now) throws SQLException;

  /**
   * Loads one delivery row.
   *
   * @param conn       the JDBC connection
   * @param deliveryId the delivery id
   * @return the row, or empty if it does not exist
   * @throws SQLException on a database error
   */
  Optional<WebhookDelivery> findDelivery(Connection conn, long deliveryId) throws SQLException;

  /**
   * Lists a webhook's delivery rows, newest first.
   *
   * @param conn      the JDBC connection
   * @param webhookId the webhook id
   * @param limit     page size
   * @param offset    rows to skip
   * @return delivery rows
   * @throws SQLException on a database error
   */
  List<WebhookDelivery> findDeliveries(Connection conn, long webhookId, int limit, int offset)
      throws SQLException;
}
