package io.scilit;

import java.sql.Connection;

/**
 * Work run against a scoped connection by {@link DatabaseManager#withConnection}
 * or {@link DatabaseManager#withTransaction}.
 *
 * <p>The connection is only valid for the duration of the call; it must not be
 * stored, closed, or handed to another thread.
 *
 * @param <T> result type
 * @param <E> checked exception the work may throw; it reaches the caller unchanged
 */
@FunctionalInterface
public interface ConnectionCallback<T, E extends Exception> {
  T doInConnection(Connection connection) throws E;
}
