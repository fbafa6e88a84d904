package io.scilit;

/**
 * Thrown when a transaction scope is opened on a thread that is already inside one.
 * Transactions never nest.
 */
public final class TransactionAlreadyOpenException extends StoreException {
  public TransactionAlreadyOpenException(String operation, String openOperation) {
    super("Cannot begin transaction '" + operation + "': transaction '" + openOperation
        + "' is already open on this thread");
  }
}
