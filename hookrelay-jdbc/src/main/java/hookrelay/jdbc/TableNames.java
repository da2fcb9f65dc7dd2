package hookrelay.jdbc;

import java.util.Objects;

/**
 * Default table names and table name validation for the JDBC webhook stores.
 */
public final class TableNames {
  public static final String DEFAULT_WEBHOOKS_TABLE = "webhooks";
  public static final String DEFAULT_DELIVERIES_TABLE = "webhook_deliveries";
  public static final String DEFAULT_SUBSCRIPTIONS_TABLE = "webhook_subscriptions";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
