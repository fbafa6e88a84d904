package io.scilit.schema;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link SchemaValidator#validateSchema()}.
 *
 * @param valid       true iff {@code issues} is empty
 * @param issues      one human-readable line per discrepancy, naming the missing object
 * @param tableCount  user and virtual tables, excluding SQLite internals and FTS shadow tables
 * @param indexCount  explicitly created indexes, excluding automatic ones
 * @param ftsEnabled  whether the full-text search table exists
 */
public record ValidationReport(boolean valid, List<String> issues, int tableCount, int indexCount,
    boolean ftsEnabled) {

  public ValidationReport {
    issues = List.copyOf(Objects.requireNonNull(issues, "issues"));
    if (valid != issues.isEmpty()) {
      throw new IllegalArgumentException("valid must be true iff there are no issues");
    }
  }

  static ValidationReport of(List<String> issues, int tableCount, int indexCount, boolean ftsEnabled) {
    return new ValidationReport(issues.isEmpty(), issues, tableCount, indexCount, ftsEnabled);
  }
}
