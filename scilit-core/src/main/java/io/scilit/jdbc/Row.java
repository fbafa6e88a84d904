package io.scilit.jdbc;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One result row: column labels in select order, each with its value.
 *
 * <p>Accessors fail with {@link IllegalArgumentException} for a column the row
 * does not have, so a missing column is never confused with a {@code NULL} value.
 * When a label repeats (joins), name lookup returns the first occurrence;
 * {@link #get(int)} reaches the others.
 */
public final class Row {
  private final List<String> columns;
  private final List<Object> values;
  private final Map<String, Integer> positions;

  private Row(List<String> columns, List<Object> values) {
    this.columns = Collections.unmodifiableList(columns);
    this.values = Collections.unmodifiableList(values);
    Map<String, Integer> index = new HashMap<>();
    for (int i = 0; i < columns.size(); i++) {
      index.putIfAbsent(columns.get(i), i);
    }
    this.positions = index;
  }

  /** Reads the current row of a result set. */
  public static Row of(ResultSet rs) throws SQLException {
    ResultSetMetaData meta = rs.getMetaData();
    int count = meta.getColumnCount();
    List<String> columns = new ArrayList<>(count);
    List<Object> values = new ArrayList<>(count);
    for (int i = 1; i <= count; i++) {
      columns.add(meta.getColumnLabel(i));
      values.add(rs.getObject(i));
    }
    return new Row(columns, values);
  }

  /** Builds a row from ordered column/value pairs. */
  public static Row of(Map<String, ?> orderedValues) {
    Objects.requireNonNull(orderedValues, "orderedValues");
    return new Row(new ArrayList<String>(orderedValues.keySet()), new ArrayList<Object>(orderedValues.values()));
  }

  public List<String> columns() {
    return columns;
  }

  public int size() {
    return columns.size();
  }

  public boolean has(String column) {
    return positions.containsKey(column);
  }

  public Object get(int index) {
    return values.get(index);
  }

  public Object get(String column) {
    return values.get(position(column));
  }

  public <T> T get(String column, Class<T> type) {
    Objects.requireNonNull(type, "type");
    Object value = get(column);
    if (value == null) {
      return null;
    }
    if (!type.isInstance(value)) {
      throw new ClassCastException("Column '" + column + "' holds " + value.getClass().getSimpleName()
          + ", not " + type.getSimpleName());
    }
    return type.cast(value);
  }

  public String getString(String column) {
    Object value = get(column);
    return value == null ? null : value.toString();
  }

  public Long getLong(String column) {
    Number n = number(column);
    return n == null ? null : n.longValue();
  }

  public Integer getInt(String column) {
    Number n = number(column);
    return n == null ? null : Math.toIntExact(n.longValue());
  }

  public Double getDouble(String column) {
    Number n = number(column);
    return n == null ? null : n.doubleValue();
  }

  /** SQLite has no boolean type; non-zero integers are {@code true}. */
  public Boolean getBoolean(String column) {
    Number n = number(column);
    return n == null ? null : n.longValue() != 0;
  }

  /** Column/value pairs in select order (first occurrence of repeated labels). */
  public Map<String, Object> asMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    for (int i = 0; i < columns.size(); i++) {
      map.putIfAbsent(columns.get(i), values.get(i));
    }
    return Collections.unmodifiableMap(map);
  }

  private Number number(String column) {
    Object value = get(column);
    if (value == null) {
      return null;
    }
    if (value instanceof Number n) {
      return n;
    }
    throw new ClassCastException("Column '" + column + "' holds " + value.getClass().getSimpleName()
        + ", not a number");
  }

  private int position(String column) {
    Integer position = positions.get(column);
    if (position == null) {
      throw new IllegalArgumentException("No column '" + column + "' in " + columns);
    }
    return position;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Row other)) {
      return false;
    }
    return columns.equals(other.columns) && valuesEqual(other);
  }

  private boolean valuesEqual(Row other) {
    for (int i = 0; i < values.size(); i++) {
      if (!Objects.deepEquals(values.get(i), other.values.get(i))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    return Objects.hash(columns, values.size());
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("Row{");
    for (int i = 0; i < columns.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(columns.get(i)).append('=').append(values.get(i));
    }
    return sb.append('}').toString();
  }
}
