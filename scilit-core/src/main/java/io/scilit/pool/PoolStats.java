package io.scilit.pool;

/**
 * Point-in-time view of a {@link ConnectionPool}.
 *
 * @param size           fixed number of slots
 * @param live           open connections, idle or checked out (never above {@code size})
 * @param idle           connections waiting to be acquired
 * @param checkedOut     connections currently owned by a borrower
 * @param totalAcquired  successful acquisitions since the pool was opened
 * @param totalExhausted acquisitions that timed out
 * @param closed         whether {@link ConnectionPool#closeAll()} has been called
 */
public record PoolStats(
    int size,
    int live,
    int idle,
    int checkedOut,
    long totalAcquired,
    long totalExhausted,
    boolean closed) {
}
