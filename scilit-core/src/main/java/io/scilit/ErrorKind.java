package io.scilit;

import java.sql.SQLException;

/**
 * Coarse classification of store errors, derived from SQLite primary result codes.
 */
public enum ErrorKind {
  /** Constraint violation (unique, foreign key, check, not null). */
  CONSTRAINT,
  /** Generic SQL error: syntax, unknown table or column, bad binding. */
  SYNTAX,
  /** I/O failure, corruption, full disk, unopenable file. */
  IO,
  /** Database busy or locked by another connection. */
  BUSY,
  OTHER;

  private static final int SQLITE_ERROR = 1;
  private static final int SQLITE_BUSY = 5;
  private static final int SQLITE_LOCKED = 6;
  private static final int SQLITE_IOERR = 10;
  private static final int SQLITE_CORRUPT = 11;
  private static final int SQLITE_FULL = 13;
  private static final int SQLITE_CANTOPEN = 14;
  private static final int SQLITE_CONSTRAINT = 19;
  private static final int SQLITE_MISMATCH = 20;
  private static final int SQLITE_RANGE = 25;
  private static final int SQLITE_NOTADB = 26;

  /** Classifies an exception by walking its cause chain for the first {@link SQLException}. */
  public static ErrorKind of(Throwable error) {
    for (Throwable t = error; t != null; t = t.getCause()) {
      if (t instanceof SQLException sql) {
        return fromResultCode(sql.getErrorCode());
      }
    }
    return OTHER;
  }

  /** Maps a SQLite result code (primary or extended) to a kind. */
  public static ErrorKind fromResultCode(int resultCode) {
    switch (resultCode & 0xff) {
      case SQLITE_CONSTRAINT:
        return CONSTRAINT;
      case SQLITE_ERROR:
      case SQLITE_MISMATCH:
      case SQLITE_RANGE:
        return SYNTAX;
      case SQLITE_IOERR:
      case SQLITE_CORRUPT:
      case SQLITE_FULL:
      case SQLITE_CANTOPEN:
      case SQLITE_NOTADB:
        return IO;
      case SQLITE_BUSY:
      case SQLITE_LOCKED:
        return BUSY;
      default:
        return OTHER;
    }
  }
}
