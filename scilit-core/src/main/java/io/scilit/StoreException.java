package io.scilit;

/**
 * Unchecked exception wrapping failures of the storage access layer.
 *
 * <p>Subclasses name the failures callers are expected to tell apart; a plain
 * {@code StoreException} wraps an unexpected JDBC error (opening a connection,
 * committing a transaction).
 */
public class StoreException extends RuntimeException {
  public StoreException(String message) {
    super(message);
  }

  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
