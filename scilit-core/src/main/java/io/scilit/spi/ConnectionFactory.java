package io.scilit.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens physical connections for a {@link io.scilit.pool.ConnectionPool}.
 *
 * <p>Each call must return a new, fully configured connection. The pool owns
 * the returned connection and closes it when it is discarded or the pool shuts down.
 *
 * @see io.scilit.jdbc.SqliteConnectionFactory
 */
@FunctionalInterface
public interface ConnectionFactory {

    /**
     * Opens a new connection.
     *
     * @return an open connection in auto-commit mode
     * @throws SQLException if the connection cannot be opened or configured
     */
    Connection open() throws SQLException;
}
