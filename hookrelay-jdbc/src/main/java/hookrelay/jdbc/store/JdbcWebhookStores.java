package hookrelay.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC webhook stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/hookrelay.jdbc.store.AbstractJdbcWebhookStore}.
 * Registered instances use the default table names; derive customized copies with
 * {@link AbstractJdbcWebhookStore#withTables} and
 * {@link AbstractJdbcWebhookStore#withJsonCodec}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * AbstractJdbcWebhookStore store = JdbcWebhookStores.detect(dataSource);
 * AbstractJdbcWebhookStore pg = JdbcWebhookStores.get("postgresql")
 *     .withTables("hooks", "hook_deliveries", "hook_subscriptions");
 * }</pre>
 */
public final class JdbcWebhookStores {

  private static final List<AbstractJdbcWebhookStore> STORES;
  private static final Map<String, AbstractJdbcWebhookStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcWebhookStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcWebhookStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(), store);
    }
  }

  private JdbcWebhookStores() {
  }

  /**
   * Returns all registered webhook stores.
   */
  public static List<AbstractJdbcWebhookStore> all() {
    return STORES;
  }

  /**
   * Gets a webhook store by name.
   *
   * @param name store name (case-insensitive)
   * @return the store
   * @throws IllegalArgumentException if no store is registered under that name
   */
  public static AbstractJdbcWebhookStore get(String name) {
    Objects.requireNonNull(name, "name");
    AbstractJdbcWebhookStore store = BY_NAME.get(name.toLowerCase());
    if (store == null) {
      throw new IllegalArgumentException("Unknown webhook store: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Auto-detects the webhook store from a DataSource.
   *
   * @param dataSource the data source
   * @return detected store
   * @throws IllegalStateException if the connection URL cannot be read
   * @throws IllegalArgumentException if no store matches the URL
   */
  public static AbstractJdbcWebhookStore detect(DataSource dataSource) {
    Objects.requireNonNull(dataSource, "dataSource");
    String url;
    try (Connection conn = dataSource.getConnection()) {
      url = conn.getMetaData().getURL();
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect webhook store from DataSource", e);
    }
    return detect(url);
  }

  /**
   * Auto-detects the webhook store from a JDBC URL.
   *
   * @param jdbcUrl the JDBC URL
   * @return detected store
   * @throws IllegalArgumentException if no store matches the URL
   */
  public static AbstractJdbcWebhookStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String lower = jdbcUrl.toLowerCase();
    for (AbstractJdbcWebhookStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (lower.startsWith(prefix.toLowerCase())) {
          return store;
        }
      }
    }
    throw new IllegalArgumentException("No webhook store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
