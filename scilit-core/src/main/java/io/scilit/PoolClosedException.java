package io.scilit;

/**
 * Thrown when a connection is requested from a pool that has been closed.
 */
public final class PoolClosedException extends StoreException {
  public PoolClosedException() {
    super("Connection pool has been closed");
  }
}
