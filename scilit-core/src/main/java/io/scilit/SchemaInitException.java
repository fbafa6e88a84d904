package io.scilit;

/**
 * Thrown when the schema script cannot be read, parsed or executed during
 * {@link DatabaseManager#initialize()}. Not retried: the script or the file
 * has to be fixed before the manager can be initialized.
 */
public final class SchemaInitException extends StoreException {
  public SchemaInitException(String message) {
    super(message);
  }

  public SchemaInitException(String message, Throwable cause) {
    super(message, cause);
  }
}
