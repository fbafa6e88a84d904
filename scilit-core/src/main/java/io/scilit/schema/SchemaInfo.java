package io.scilit.schema;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot of the live catalog, for diagnostics.
 */
public record SchemaInfo(List<TableInfo> tables, List<IndexInfo> indexes, List<ViewInfo> views,
    List<TriggerInfo> triggers) {

  public SchemaInfo {
    tables = List.copyOf(Objects.requireNonNull(tables, "tables"));
    indexes = List.copyOf(Objects.requireNonNull(indexes, "indexes"));
    views = List.copyOf(Objects.requireNonNull(views, "views"));
    triggers = List.copyOf(Objects.requireNonNull(triggers, "triggers"));
  }

  public Optional<TableInfo> table(String name) {
    return tables.stream().filter(t -> t.name().equals(name)).findFirst();
  }

  /** A table and its columns in declaration order. */
  public record TableInfo(String name, boolean virtual, List<ColumnInfo> columns) {
    public TableInfo {
      columns = List.copyOf(columns);
    }
  }

  /**
   * One column as reported by {@code pragma_table_info}.
   *
   * @param primaryKeyPosition 1-based position within the primary key, 0 if not part of it
   */
  public record ColumnInfo(String name, String type, boolean notNull, String defaultValue,
      int primaryKeyPosition) {
  }

  /**
   * @param origin {@code c} for CREATE INDEX, {@code u} for UNIQUE constraints, {@code pk} for primary keys
   */
  public record IndexInfo(String name, String table, boolean unique, String origin, List<String> columns) {
    public IndexInfo {
      columns = List.copyOf(columns);
    }
  }

  public record ViewInfo(String name, String sql) {
  }

  public record TriggerInfo(String name, String table, String sql) {
  }
}
