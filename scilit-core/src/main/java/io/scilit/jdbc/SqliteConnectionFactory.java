package io.scilit.jdbc;

import io.scilit.DatabaseConfig;
import io.scilit.SynchronousMode;
import io.scilit.spi.ConnectionFactory;

import org.sqlite.SQLiteConfig;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link ConnectionFactory} opening SQLite connections to the configured database file.
 *
 * <p>Pragmas that SQLite scopes to a single connection are applied to every
 * connection it opens: foreign-key enforcement, {@code synchronous}, the page
 * cache bound and the busy timeout. The journal mode is a property of the file
 * and is set once by {@link io.scilit.DatabaseManager#initialize()}.
 */
public final class SqliteConnectionFactory implements ConnectionFactory {
  private final String url;
  private final SQLiteConfig sqliteConfig;

  public SqliteConnectionFactory(DatabaseConfig config) {
    Objects.requireNonNull(config, "config");
    this.url = config.jdbcUrl();
    this.sqliteConfig = new SQLiteConfig();
    sqliteConfig.enforceForeignKeys(true);
    sqliteConfig.setSynchronous(toSqlite(config.synchronousMode()));
    sqliteConfig.setCacheSize(config.cacheSizePages());
    sqliteConfig.setBusyTimeout((int) config.busyTimeout().toMillis());
  }

  @Override
  public Connection open() throws SQLException {
    return sqliteConfig.createConnection(url);
  }

  public String url() {
    return url;
  }

  private static SQLiteConfig.SynchronousMode toSqlite(SynchronousMode mode) {
    return switch (mode) {
      case OFF -> SQLiteConfig.SynchronousMode.OFF;
      case NORMAL -> SQLiteConfig.SynchronousMode.NORMAL;
      case FULL -> SQLiteConfig.SynchronousMode.FULL;
    };
  }
}
