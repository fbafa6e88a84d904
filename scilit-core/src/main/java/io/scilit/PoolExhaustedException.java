package io.scilit;

import java.time.Duration;

/**
 * Thrown when no pooled connection became idle within the acquisition timeout.
 *
 * <p>Signals backpressure: the caller may retry later or surface the overload.
 */
public final class PoolExhaustedException extends StoreException {
  private final int poolSize;
  private final Duration timeout;

  public PoolExhaustedException(int poolSize, Duration timeout) {
    super("No idle connection among " + poolSize + " within " + timeout.toMillis() + "ms");
    this.poolSize = poolSize;
    this.timeout = timeout;
  }

  public int poolSize() {
    return poolSize;
  }

  public Duration timeout() {
    return timeout;
  }
}
