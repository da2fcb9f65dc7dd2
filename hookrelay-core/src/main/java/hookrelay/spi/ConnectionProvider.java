package hookrelay.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for the relay's store calls (webhook lookups,
 * delivery rows, retry scans).
 *
 * <p>Callers are responsible for closing the returned connection.
 *
 * @see hookrelay.jdbc.DataSourceConnectionProvider
 */
@FunctionalInterface
public interface ConnectionProvider {

    /**
     * Obtains a new JDBC connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
