package io.scilit.jdbc;

import io.scilit.StoreException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Lightweight JDBC helper. Every statement goes through a {@link PreparedStatement};
 * values are always bound, never concatenated into SQL.
 */
public final class JdbcTemplate {
  private static final String NO_ACTIVE_TRANSACTION = "no transaction is active";

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** Execute INSERT/UPDATE/DELETE or DDL, return rows affected. */
  public static int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new StoreException("Failed to execute update", e);
    }
  }

  /** Execute SELECT, map rows. */
  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        return mapAll(rs, mapper);
      }
    } catch (SQLException e) {
      throw new StoreException("Failed to execute query", e);
    }
  }

  /** Execute SELECT, map the first row if there is one. */
  public static <T> Optional<T> queryFirst(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    List<T> rows = query(conn, sql, mapper, params);
    return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
  }

  /** Execute SELECT, return generic rows. */
  public static List<Row> queryRows(Connection conn, String sql, Object... params) {
    return query(conn, sql, Row::of, params);
  }

  /**
   * Execute any single statement and map its result set, if it produces one.
   * Statements without a result set (DML, DDL) yield an empty list.
   * Unlike the other helpers this one surfaces the raw {@link SQLException}.
   */
  public static <T> List<T> execute(Connection conn, String sql, RowMapper<T> mapper, Object... params)
      throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      if (!ps.execute()) {
        return Collections.emptyList();
      }
      try (ResultSet rs = ps.getResultSet()) {
        return mapAll(rs, mapper);
      }
    }
  }

  /** Execute a statement that takes no parameters, such as a pragma. */
  public static void executeStatement(Connection conn, String sql) throws SQLException {
    try (Statement st = conn.createStatement()) {
      st.execute(sql);
    }
  }

  /**
   * Rolls back whatever transaction {@code conn} holds. The driver keeps reporting
   * auto-commit for a transaction opened with a plain {@code BEGIN} statement, so in
   * auto-commit mode an explicit {@code ROLLBACK} is issued and SQLite's "no transaction
   * is active" error is read as a clean connection.
   *
   * @return true if a transaction was open and has been rolled back
   */
  public static boolean rollbackPending(Connection conn) throws SQLException {
    if (!conn.getAutoCommit()) {
      conn.rollback();
      return true;
    }
    try (Statement st = conn.createStatement()) {
      st.execute("ROLLBACK");
      return true;
    } catch (SQLException e) {
      if (isNoActiveTransaction(e)) {
        return false;
      }
      throw e;
    }
  }

  private static boolean isNoActiveTransaction(SQLException e) {
    String message = e.getMessage();
    return message != null && message.contains(NO_ACTIVE_TRANSACTION);
  }

  public static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Long n) {
        ps.setLong(i + 1, n);
      } else if (param instanceof Double d) {
        ps.setDouble(i + 1, d);
      } else if (param instanceof Boolean b) {
        ps.setInt(i + 1, b ? 1 : 0);
      } else if (param instanceof byte[] bytes) {
        ps.setBytes(i + 1, bytes);
      } else if (param instanceof LocalDate date) {
        // DATE columns hold ISO-8601 text
        ps.setString(i + 1, date.toString());
      } else if (param instanceof Timestamp ts) {
        ps.setTimestamp(i + 1, ts);
      } else if (param instanceof Enum<?> e) {
        ps.setString(i + 1, e.name());
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  private static <T> List<T> mapAll(ResultSet rs, RowMapper<T> mapper) throws SQLException {
    List<T> results = new ArrayList<>();
    while (rs.next()) {
      results.add(mapper.map(rs));
    }
    return results;
  }

  private JdbcTemplate() {}
}
