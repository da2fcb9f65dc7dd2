package hookrelay.history;

import hookrelay.model.WebhookDelivery;
import hookrelay.spi.ConnectionProvider;
import hookrelay.spi.WebhookStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-only facade over delivery history for operators and management screens.
 *
 * <p>Manages connection lifecycle internally using a {@link ConnectionProvider}.
 * Store failures are logged and reported as empty results.
 *
 * @see WebhookStore#findDeliveries
 * @see WebhookStore#findPendingRetries
 */
public final class DeliveryHistory {
  private static final Logger logger = Logger.getLogger(DeliveryHistory.class.getName());

  private final ConnectionProvider connectionProvider;
  private final WebhookStore store;

  public DeliveryHistory(ConnectionProvider connectionProvider, WebhookStore store) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(store, "store");
  }

  /**
   * Lists a webhook's attempts, newest first.
   *
   * @param webhookId the webhook id
   * @param limit     page size, must be &gt; 0
   * @param offset    rows to skip, must be &ge; 0
   * @return one page of delivery rows
   */
  public List<WebhookDelivery> forWebhook(long webhookId, int limit, int offset) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    if (offset < 0) {
      throw new IllegalArgumentException("offset must be >= 0");
    }
    try (Connection conn = connectionProvider.getConnection()) {
      return store.findDeliveries(conn, webhookId, limit, offset);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to list deliveries for webhookId=" + webhookId, e);
      return List.of();
    }
  }

  /**
   * Loads a single attempt.
   *
   * @param deliveryId the delivery id
   * @return the row, or empty if not found or on failure
   */
  public Optional<WebhookDelivery> find(long deliveryId) {
    try (Connection conn = connectionProvider.getConnection()) {
      return store.findDelivery(conn, deliveryId);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to load deliveryId=" + deliveryId, e);
      return Optional.empty();
    }
  }

  /**
   * Lists retries that are due now, as the retry scheduler would see them.
   *
   * @param limit maximum rows
   * @return due rows, oldest due first
   */
  public List<WebhookDelivery> pendingRetries(int limit) {
    try (Connection conn = connectionProvider.getConnection()) {
      return store.findPendingRetries(conn, Instant.now(), limit);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to list pending retries", e);
      return List.of();
    }
  }
}
