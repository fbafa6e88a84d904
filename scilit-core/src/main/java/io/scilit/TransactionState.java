package io.scilit;

/**
 * Lifecycle of a {@link DatabaseManager.Transaction}: {@code BEGUN} until it ends in
 * exactly one of {@code COMMITTED} or {@code ROLLED_BACK}. Writes are pending only while
 * {@code BEGUN}.
 */
public enum TransactionState {
  BEGUN,
  COMMITTED,
  ROLLED_BACK
}
