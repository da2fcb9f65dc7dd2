/**
 * JDBC-based {@link hookrelay.spi.WebhookStore} implementations.
 *
 * <p>{@link hookrelay.jdbc.store.AbstractJdbcWebhookStore} provides shared SQL and row mapping;
 * subclasses supply database-specific parameter casts and statements: H2 (standard SQL),
 * MySQL (standard SQL) and PostgreSQL (JSONB/UUID casts, {@code RETURNING}).
 * Schemas ship as {@code schema/h2.sql}, {@code schema/mysql.sql} and
 * {@code schema/postgresql.sql}.
 *
 * @see hookrelay.jdbc.store.AbstractJdbcWebhookStore
 * @see hookrelay.jdbc.store.H2WebhookStore
 * @see hookrelay.jdbc.store.MySqlWebhookStore
 * @see hookrelay.jdbc.store.PostgresWebhookStore
 * @see hookrelay.jdbc.store.JdbcWebhookStores
 */
package hookrelay.jdbc.store;
