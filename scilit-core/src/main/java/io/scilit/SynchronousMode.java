package io.scilit;

/**
 * Value of SQLite's {@code synchronous} pragma applied to every pooled connection.
 *
 * <p>{@link #NORMAL} is safe in WAL mode: a power loss can roll back the most
 * recent commits but cannot corrupt the file.
 */
public enum SynchronousMode {
  OFF,
  NORMAL,
  FULL
}
