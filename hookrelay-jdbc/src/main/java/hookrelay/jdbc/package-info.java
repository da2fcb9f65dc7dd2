/**
 * JDBC plumbing shared by the webhook stores: {@link hookrelay.jdbc.JdbcTemplate},
 * table name validation and a {@link javax.sql.DataSource}-backed connection provider.
 *
 * @see hookrelay.jdbc.store
 */
package hookrelay.jdbc;
