package io.scilit.pool;

import io.scilit.PoolClosedException;
import io.scilit.PoolExhaustedException;
import io.scilit.StoreException;
import io.scilit.jdbc.JdbcTemplate;
import io.scilit.spi.ConnectionFactory;
import io.scilit.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fixed-size pool of connections to one database file.
 *
 * <p>All connections are opened at construction. {@link #acquire()} blocks the
 * calling thread until a connection is idle or the acquisition timeout elapses;
 * {@link #release(Connection)} hands it back after making sure no transaction is
 * left open on it. A connection that is closed, marked via {@link #invalidate(Connection)},
 * or cannot be reset is discarded on release and replaced lazily on a later
 * acquisition, so the pool never holds more than {@code size} live connections.
 *
 * <p>This class is thread-safe. A checked-out connection belongs to its borrower
 * alone until it is released.
 */
public final class ConnectionPool implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ConnectionPool.class.getName());

  private static final int VALIDATION_TIMEOUT_SECONDS = 2;

  private final ConnectionFactory connectionFactory;
  private final int size;
  private final Duration acquireTimeout;
  private final MetricsExporter metrics;
  private final Semaphore permits;

  private final Object lock = new Object();
  private final Deque<Connection> idle = new ArrayDeque<>();
  private final Set<Connection> checkedOut = Collections.newSetFromMap(new IdentityHashMap<>());
  private final Set<Connection> unhealthy = Collections.newSetFromMap(new IdentityHashMap<>());
  private int live;
  private volatile boolean closed;

  private final AtomicLong totalAcquired = new AtomicLong();
  private final AtomicLong totalExhausted = new AtomicLong();

  public ConnectionPool(ConnectionFactory connectionFactory, int size, Duration acquireTimeout) {
    this(connectionFactory, size, acquireTimeout, MetricsExporter.NOOP);
  }

  public ConnectionPool(ConnectionFactory connectionFactory, int size, Duration acquireTimeout,
      MetricsExporter metrics) {
    this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
    this.acquireTimeout = Objects.requireNonNull(acquireTimeout, "acquireTimeout");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (size < 1) {
      throw new IllegalArgumentException("size must be >= 1");
    }
    if (acquireTimeout.isNegative() || acquireTimeout.isZero()) {
      throw new IllegalArgumentException("acquireTimeout must be > 0");
    }
    this.size = size;
    this.permits = new Semaphore(size, true);

    for (int i = 0; i < size; i++) {
      try {
        idle.addLast(connectionFactory.open());
        live++;
      } catch (SQLException e) {
        idle.forEach(this::closeQuietly);
        idle.clear();
        throw new StoreException("Failed to open connection " + (i + 1) + " of " + size, e);
      }
    }
    logger.info("Connection pool opened with " + size + " connections");
    recordUsage();
  }

  /**
   * Checks out an idle connection, waiting up to the acquisition timeout.
   *
   * @return a connection owned by the caller until {@link #release(Connection)}
   * @throws PoolExhaustedException if no connection became idle in time
   * @throws PoolClosedException if the pool has been closed
   * @throws StoreException if a replacement connection cannot be opened
   */
  public Connection acquire() {
    if (closed) {
      throw new PoolClosedException();
    }
    boolean acquired;
    try {
      acquired = permits.tryAcquire(acquireTimeout.toNanos(), TimeUnit.NANOSECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StoreException("Interrupted while waiting for a connection", e);
    }
    if (!acquired) {
      totalExhausted.incrementAndGet();
      metrics.incrementPoolExhausted();
      throw new PoolExhaustedException(size, acquireTimeout);
    }
    try {
      Connection connection = checkOut();
      totalAcquired.incrementAndGet();
      recordUsage();
      return connection;
    } catch (RuntimeException e) {
      permits.release();
      throw e;
    }
  }

  /**
   * Returns a checked-out connection. An open transaction is rolled back first;
   * an unusable connection is closed and its slot refilled on a later acquisition.
   *
   * @throws IllegalStateException if the connection is not currently checked out from this pool
   */
  public void release(Connection connection) {
    Objects.requireNonNull(connection, "connection");
    boolean broken;
    synchronized (lock) {
      if (!checkedOut.remove(connection)) {
        throw new IllegalStateException("Connection is not checked out from this pool");
      }
      broken = unhealthy.remove(connection);
    }
    try {
      if (broken || closed || !resetForReuse(connection)) {
        discard(connection);
        return;
      }
      boolean returned = false;
      synchronized (lock) {
        if (!closed) {
          idle.addFirst(connection);
          returned = true;
        }
      }
      if (!returned) {
        discard(connection);
      }
    } finally {
      permits.release();
      recordUsage();
    }
  }

  /**
   * Marks a checked-out connection as unhealthy; it is closed instead of reused when released.
   *
   * @throws IllegalStateException if the connection is not currently checked out from this pool
   */
  public void invalidate(Connection connection) {
    Objects.requireNonNull(connection, "connection");
    synchronized (lock) {
      if (!checkedOut.contains(connection)) {
        throw new IllegalStateException("Connection is not checked out from this pool");
      }
      unhealthy.add(connection);
    }
  }

  /**
   * Closes every idle connection and refuses further acquisitions. Connections still
   * checked out are closed when they are released. Threads blocked in {@link #acquire()}
   * fail with {@link PoolClosedException}.
   */
  public void closeAll() {
    List<Connection> toClose;
    int stillCheckedOut;
    synchronized (lock) {
      if (closed) {
        return;
      }
      closed = true;
      toClose = new ArrayList<>(idle);
      idle.clear();
      live -= toClose.size();
      stillCheckedOut = checkedOut.size();
    }
    toClose.forEach(this::closeQuietly);
    permits.release(size);
    recordUsage();
    logger.info("Connection pool closed: " + toClose.size() + " idle connections closed, "
        + stillCheckedOut + " still checked out");
  }

  @Override
  public void close() {
    closeAll();
  }

  public int size() {
    return size;
  }

  public Duration acquireTimeout() {
    return acquireTimeout;
  }

  public boolean isClosed() {
    return closed;
  }

  public PoolStats stats() {
    synchronized (lock) {
      return new PoolStats(size, live, idle.size(), checkedOut.size(),
          totalAcquired.get(), totalExhausted.get(), closed);
    }
  }

  private Connection checkOut() {
    while (true) {
      Connection candidate;
      synchronized (lock) {
        if (closed) {
          throw new PoolClosedException();
        }
        candidate = idle.pollFirst();
        if (candidate == null) {
          // slot freed by an earlier discard; reserve it before opening outside the lock
          live++;
        }
      }
      if (candidate == null) {
        Connection fresh;
        try {
          fresh = connectionFactory.open();
        } catch (SQLException e) {
          synchronized (lock) {
            live--;
          }
          throw new StoreException("Failed to open replacement connection", e);
        }
        logger.fine("Opened replacement connection");
        synchronized (lock) {
          checkedOut.add(fresh);
        }
        return fresh;
      }
      if (isUsable(candidate)) {
        synchronized (lock) {
          checkedOut.add(candidate);
        }
        return candidate;
      }
      logger.warning("Idle connection failed validation; discarding it");
      discard(candidate);
    }
  }

  private boolean isUsable(Connection connection) {
    try {
      return !connection.isClosed() && connection.isValid(VALIDATION_TIMEOUT_SECONDS);
    } catch (SQLException e) {
      logger.log(Level.FINE, "Connection validation failed", e);
      return false;
    }
  }

  private boolean resetForReuse(Connection connection) {
    try {
      if (connection.isClosed()) {
        logger.warning("Released connection was closed by its borrower; discarding it");
        return false;
      }
      if (JdbcTemplate.rollbackPending(connection)) {
        logger.warning("Released connection still had an open transaction; rolled back");
      }
      if (!connection.getAutoCommit()) {
        connection.setAutoCommit(true);
      }
      return true;
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Failed to reset released connection; discarding it", e);
      return false;
    }
  }

  private void discard(Connection connection) {
    synchronized (lock) {
      live--;
    }
    closeQuietly(connection);
  }

  private void closeQuietly(Connection connection) {
    try {
      if (!connection.isClosed()) {
        connection.close();
      }
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Failed to close connection", e);
    }
  }

  private void recordUsage() {
    int inUse;
    int idleCount;
    synchronized (lock) {
      inUse = checkedOut.size();
      idleCount = idle.size();
    }
    metrics.recordPoolUsage(inUse, idleCount);
  }
}
