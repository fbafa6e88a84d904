package io.scilit;

import io.scilit.jdbc.JdbcTemplate;
import io.scilit.jdbc.SqlScript;
import io.scilit.jdbc.SqliteConnectionFactory;
import io.scilit.pool.ConnectionPool;
import io.scilit.pool.PoolStats;
import io.scilit.spi.MetricsExporter;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point to the database file: owns the connection pool, bootstraps the
 * schema and hands out scoped connections and transactions.
 *
 * <p>Callers never hold a raw connection outside a scope:
 * <pre>{@code
 * long authors = manager.withConnection("count-authors", conn ->
 *     JdbcTemplate.queryFirst(conn, "SELECT COUNT(*) FROM authors", rs -> rs.getLong(1)).orElse(0L));
 *
 * manager.withTransaction("add-author", conn ->
 *     JdbcTemplate.update(conn, "INSERT INTO authors (name) VALUES (?)", "Ada Lovelace"));
 * }</pre>
 *
 * <p>Both scopes release the connection exactly once on every exit path. A
 * failing scope rolls back, logs the operation name and error kind, and rethrows
 * the original exception.
 *
 * <p>This class is thread-safe.
 *
 * @see DatabaseConfig
 * @see Transaction
 */
public final class DatabaseManager implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(DatabaseManager.class.getName());

  static final String SCHEMA_FILE_NAME = "schema.sql";
  static final String BUNDLED_SCHEMA = "/io/scilit/schema/schema.sql";

  private final DatabaseConfig config;
  private final ConnectionPool pool;
  private final MetricsExporter metrics;
  private final ThreadLocal<Transaction> currentTransaction = new ThreadLocal<>();

  private volatile boolean initialized;
  private SchemaInitException initFailure;

  public DatabaseManager(DatabaseConfig config) {
    this(config, MetricsExporter.NOOP);
  }

  public DatabaseManager(DatabaseConfig config, MetricsExporter metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    createParentDirectory(config.path());
    this.pool = new ConnectionPool(new SqliteConnectionFactory(config), config.poolSize(),
        config.acquireTimeout(), metrics);
  }

  DatabaseManager(DatabaseConfig config, ConnectionPool pool, MetricsExporter metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.pool = Objects.requireNonNull(pool, "pool");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Prepares the database file: journal mode, pragmas, schema. Runs once; later
   * calls return immediately. A schema failure is final: every later call throws
   * again until the process is restarted with a fixed script.
   *
   * @throws SchemaInitException if the schema script cannot be read, parsed or executed
   */
  public synchronized void initialize() {
    if (initFailure != null) {
      throw new SchemaInitException("Schema initialization already failed for " + config.path()
          + "; fix the schema script and restart", initFailure);
    }
    if (initialized) {
      logger.fine("Database already initialized");
      return;
    }

    logger.info("Initializing database " + config.path().toAbsolutePath());
    createParentDirectory(config.path());
    withConnection("configure-database", conn -> {
      configureJournalMode(conn);
      logEffectivePragmas(conn);
      return null;
    });

    try {
      SchemaSource source = resolveSchemaScript();
      List<String> statements = parseSchema(source);
      int executed = executeSchema(source, statements);
      logger.info("Schema from " + source.location() + " applied: " + executed + " statements");
    } catch (SchemaInitException e) {
      initFailure = e;
      logger.log(Level.SEVERE, "Schema initialization failed", e);
      throw e;
    }

    initialized = true;
    logger.info("Database initialization complete");
  }

  /**
   * Runs {@code callback} with a pooled connection and always releases it. If the
   * callback throws, an open transaction on the connection is rolled back, the
   * failure is logged and the original exception is rethrown.
   *
   * @param operation name used in logs
   * @throws PoolExhaustedException if no connection became idle in time
   * @throws PoolClosedException if the manager has been closed
   * @throws E whatever the callback throws
   */
  public <T, E extends Exception> T withConnection(String operation, ConnectionCallback<T, E> callback)
      throws E {
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(callback, "callback");
    Connection connection = pool.acquire();
    try {
      return callback.doInConnection(connection);
    } catch (Throwable t) {
      rollbackIfOpen(connection, t);
      logger.log(Level.WARNING, "Operation '" + operation + "' failed [" + ErrorKind.of(t) + "]", t);
      throw t;
    } finally {
      pool.release(connection);
    }
  }

  public <T, E extends Exception> T withConnection(ConnectionCallback<T, E> callback) throws E {
    return withConnection("connection", callback);
  }

  /**
   * Runs {@code callback} inside a transaction: BEGIN, the callback, then COMMIT.
   * Any exception from the callback (or from COMMIT) rolls the transaction back,
   * is logged and rethrown; nothing is partially committed.
   *
   * @param operation name used in logs
   * @throws TransactionAlreadyOpenException if this thread is already inside a transaction scope
   * @throws PoolExhaustedException if no connection became idle in time
   * @throws E whatever the callback throws
   */
  public <T, E extends Exception> T withTransaction(String operation, ConnectionCallback<T, E> callback)
      throws E {
    Objects.requireNonNull(callback, "callback");
    Transaction tx = begin(operation);
    try {
      T result = callback.doInConnection(tx.connection);
      tx.commit();
      return result;
    } catch (Throwable t) {
      tx.rollbackAfterFailure(t);
      throw t;
    } finally {
      tx.close();
    }
  }

  public <T, E extends Exception> T withTransaction(ConnectionCallback<T, E> callback) throws E {
    return withTransaction("transaction", callback);
  }

  /**
   * Begins a transaction on a pooled connection and binds it to the calling thread.
   * Use with try-with-resources; closing without {@link Transaction#commit()} rolls back.
   *
   * <pre>{@code
   * try (DatabaseManager.Transaction tx = manager.begin("import-batch")) {
   *     JdbcTemplate.update(tx.connection(), "INSERT INTO datasets (name) VALUES (?)", name);
   *     tx.commit();
   * }
   * }</pre>
   *
   * @throws TransactionAlreadyOpenException if this thread already holds an open transaction
   */
  public Transaction begin(String operation) {
    Objects.requireNonNull(operation, "operation");
    Transaction open = currentTransaction.get();
    if (open != null && !open.released) {
      throw new TransactionAlreadyOpenException(operation, open.operation);
    }
    Connection connection = pool.acquire();
    try {
      connection.setAutoCommit(false);
    } catch (SQLException e) {
      pool.invalidate(connection);
      pool.release(connection);
      throw new StoreException("Failed to begin transaction '" + operation + "'", e);
    }
    Transaction tx = new Transaction(this, operation, connection);
    currentTransaction.set(tx);
    logger.fine("Transaction '" + operation + "' begun");
    return tx;
  }

  /** Whether the calling thread is inside a transaction scope of this manager. */
  public boolean inTransaction() {
    Transaction open = currentTransaction.get();
    return open != null && !open.released;
  }

  public boolean isInitialized() {
    return initialized;
  }

  public DatabaseConfig config() {
    return config;
  }

  public PoolStats poolStats() {
    return pool.stats();
  }

  /** Closes every pooled connection. Scopes opened afterwards fail with {@link PoolClosedException}. */
  @Override
  public void close() {
    pool.closeAll();
    logger.info("Database manager closed for " + config.path());
  }

  private void configureJournalMode(Connection conn) {
    String requested = config.walEnabled() ? "WAL" : "DELETE";
    String mode = JdbcTemplate.queryFirst(conn, "PRAGMA journal_mode=" + requested, rs -> rs.getString(1))
        .orElse("unknown");
    if (!requested.equalsIgnoreCase(mode)) {
      logger.warning("Requested journal_mode=" + requested + " but database reports " + mode);
    } else {
      logger.info("Journal mode: " + mode.toLowerCase(Locale.ROOT));
    }
  }

  private void logEffectivePragmas(Connection conn) {
    if (!logger.isLoggable(Level.INFO)) {
      return;
    }
    StringBuilder summary = new StringBuilder("Effective pragmas:");
    for (String pragma : List.of("foreign_keys", "synchronous", "cache_size", "busy_timeout")) {
      String value = JdbcTemplate.queryFirst(conn, "PRAGMA " + pragma, rs -> rs.getString(1)).orElse("?");
      summary.append(' ').append(pragma).append('=').append(value);
    }
    logger.info(summary.toString());
  }

  private SchemaSource resolveSchemaScript() {
    if (config.schemaScript().isPresent()) {
      return readSchemaFile(config.schemaScript().get());
    }
    Path parent = config.path().toAbsolutePath().getParent();
    if (parent != null) {
      Path sibling = parent.resolve(SCHEMA_FILE_NAME);
      if (Files.isRegularFile(sibling)) {
        return readSchemaFile(sibling);
      }
    }
    try (InputStream in = DatabaseManager.class.getResourceAsStream(BUNDLED_SCHEMA)) {
      if (in == null) {
        throw new SchemaInitException("Bundled schema script " + BUNDLED_SCHEMA + " not found on classpath");
      }
      return new SchemaSource("classpath:" + BUNDLED_SCHEMA, new String(in.readAllBytes(), StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new SchemaInitException("Failed to read bundled schema script " + BUNDLED_SCHEMA, e);
    }
  }

  private static SchemaSource readSchemaFile(Path script) {
    try {
      return new SchemaSource(script.toString(), Files.readString(script, StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new SchemaInitException("Failed to read schema script " + script, e);
    }
  }

  private static List<String> parseSchema(SchemaSource source) {
    try {
      List<String> statements = SqlScript.parse(source.text()).statements();
      if (statements.isEmpty()) {
        throw new SchemaInitException("Schema script " + source.location() + " contains no statements");
      }
      return statements;
    } catch (IllegalArgumentException e) {
      throw new SchemaInitException("Failed to parse schema script " + source.location() + ": " + e.getMessage(), e);
    }
  }

  private int executeSchema(SchemaSource source, List<String> statements) {
    return withTransaction("apply-schema", conn -> {
      int executed = 0;
      try (Statement st = conn.createStatement()) {
        for (String sql : statements) {
          try {
            st.execute(sql);
          } catch (SQLException e) {
            throw new SchemaInitException("Failed to execute statement " + (executed + 1) + " of "
                + source.location() + ": " + abbreviate(sql), e);
          }
          executed++;
        }
      } catch (SQLException e) {
        throw new SchemaInitException("Failed to execute schema script " + source.location(), e);
      }
      return executed;
    });
  }

  private void rollbackIfOpen(Connection connection, Throwable failure) {
    try {
      if (!connection.isClosed() && JdbcTemplate.rollbackPending(connection)) {
        logger.fine("Rolled back open transaction after failure");
      }
    } catch (SQLException e) {
      failure.addSuppressed(e);
      pool.invalidate(connection);
    }
  }

  private static void createParentDirectory(Path path) {
    Path parent = path.toAbsolutePath().getParent();
    if (parent == null) {
      return;
    }
    try {
      Files.createDirectories(parent);
    } catch (IOException e) {
      throw new StoreException("Failed to create database directory " + parent, e);
    }
  }

  private static String abbreviate(String sql) {
    String flat = sql.replaceAll("\\s+", " ");
    return flat.length() <= 100 ? flat : flat.substring(0, 100) + "...";
  }

  private record SchemaSource(String location, String text) {
  }

  /**
   * An open transaction bound to the thread that began it. Supports explicit
   * {@link #commit()} and {@link #rollback()}; {@link #close()} rolls back if
   * neither was called and returns the connection to the pool exactly once.
   */
  public static final class Transaction implements AutoCloseable {
    private final DatabaseManager manager;
    private final String operation;
    private final Connection connection;
    private TransactionState state = TransactionState.BEGUN;
    private boolean released;

    private Transaction(DatabaseManager manager, String operation, Connection connection) {
      this.manager = manager;
      this.operation = operation;
      this.connection = connection;
    }

    /**
     * The transaction's connection.
     *
     * @throws IllegalStateException once the transaction has ended
     */
    public Connection connection() {
      if (state != TransactionState.BEGUN || released) {
        throw new IllegalStateException("Transaction '" + operation + "' is " + state);
      }
      return connection;
    }

    public String operation() {
      return operation;
    }

    public TransactionState state() {
      return state;
    }

    /**
     * Commits. A second call is a no-op. If COMMIT fails the transaction is rolled back.
     *
     * @throws IllegalStateException if the transaction was already rolled back
     * @throws StoreException if COMMIT fails
     */
    public void commit() {
      if (state == TransactionState.COMMITTED) {
        return;
      }
      if (state == TransactionState.ROLLED_BACK || released) {
        throw new IllegalStateException("Transaction '" + operation + "' is " + state + " and cannot commit");
      }
      try {
        connection.commit();
        state = TransactionState.COMMITTED;
        manager.metrics.incrementTransactionCommitted();
        logger.fine("Transaction '" + operation + "' committed");
      } catch (SQLException e) {
        StoreException failure = new StoreException("Failed to commit transaction '" + operation + "'", e);
        rollbackQuietly(failure);
        throw failure;
      }
    }

    /** Rolls back. No-op once the transaction has ended. */
    public void rollback() {
      if (state != TransactionState.BEGUN) {
        return;
      }
      try {
        connection.rollback();
      } catch (SQLException e) {
        manager.pool.invalidate(connection);
        throw new StoreException("Failed to roll back transaction '" + operation + "'", e);
      } finally {
        state = TransactionState.ROLLED_BACK;
        manager.metrics.incrementTransactionRolledBack();
      }
    }

    @Override
    public void close() {
      if (released) {
        return;
      }
      try {
        if (state == TransactionState.BEGUN) {
          logger.fine("Transaction '" + operation + "' closed without commit; rolling back");
          rollback();
        }
      } finally {
        released = true;
        if (manager.currentTransaction.get() == this) {
          manager.currentTransaction.remove();
        }
        restoreAutoCommit();
        manager.pool.release(connection);
      }
    }

    void rollbackAfterFailure(Throwable failure) {
      rollbackQuietly(failure);
      logger.log(Level.WARNING, "Transaction '" + operation + "' rolled back [" + ErrorKind.of(failure) + "]",
          failure);
    }

    private void rollbackQuietly(Throwable failure) {
      if (state != TransactionState.BEGUN) {
        return;
      }
      try {
        connection.rollback();
      } catch (SQLException e) {
        failure.addSuppressed(e);
        manager.pool.invalidate(connection);
      } finally {
        state = TransactionState.ROLLED_BACK;
        manager.metrics.incrementTransactionRolledBack();
      }
    }

    private void restoreAutoCommit() {
      try {
        if (!connection.isClosed()) {
          connection.setAutoCommit(true);
        }
      } catch (SQLException e) {
        logger.log(Level.WARNING, "Failed to restore auto-commit after transaction '" + operation
            + "'; discarding connection", e);
        manager.pool.invalidate(connection);
      }
    }
  }
}
