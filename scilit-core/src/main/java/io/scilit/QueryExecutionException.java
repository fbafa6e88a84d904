package io.scilit;

import java.util.Objects;

/**
 * Thrown when a monitored query fails. Carries the query fingerprint and the
 * classified error kind; the underlying {@link java.sql.SQLException} is the cause.
 */
public final class QueryExecutionException extends StoreException {
  private final String fingerprint;
  private final ErrorKind errorKind;

  public QueryExecutionException(String fingerprint, ErrorKind errorKind, Throwable cause) {
    super("Query failed [" + errorKind + "]: " + fingerprint, cause);
    this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint");
    this.errorKind = Objects.requireNonNull(errorKind, "errorKind");
  }

  public String fingerprint() {
    return fingerprint;
  }

  public ErrorKind errorKind() {
    return errorKind;
  }
}
