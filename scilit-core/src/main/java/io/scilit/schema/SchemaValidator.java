package io.scilit.schema;

import io.scilit.DatabaseManager;
import io.scilit.jdbc.JdbcTemplate;
import io.scilit.schema.SchemaInfo.ColumnInfo;
import io.scilit.schema.SchemaInfo.IndexInfo;
import io.scilit.schema.SchemaInfo.TableInfo;
import io.scilit.schema.SchemaInfo.TriggerInfo;
import io.scilit.schema.SchemaInfo.ViewInfo;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Compares the live catalog of the database against an {@link ExpectedSchema}.
 *
 * <p>Both operations only read {@code sqlite_master} and catalog pragmas; they
 * never modify the schema.
 */
public final class SchemaValidator {
  private static final Logger logger = Logger.getLogger(SchemaValidator.class.getName());

  private static final String CATALOG_SQL =
      "SELECT type, name, sql FROM sqlite_master ORDER BY type, name";

  private final DatabaseManager manager;
  private final ExpectedSchema expected;

  public SchemaValidator(DatabaseManager manager) {
    this(manager, ExpectedSchema.SCIENTIFIC_LITERATURE);
  }

  public SchemaValidator(DatabaseManager manager, ExpectedSchema expected) {
    this.manager = Objects.requireNonNull(manager, "manager");
    this.expected = Objects.requireNonNull(expected, "expected");
  }

  public ExpectedSchema expected() {
    return expected;
  }

  /**
   * Reports every expected table, index, FTS table and FTS trigger that is missing.
   * The report is valid iff nothing is missing.
   */
  public ValidationReport validateSchema() {
    Catalog catalog = manager.withConnection("validate-schema", SchemaValidator::readCatalog);

    List<String> issues = new ArrayList<>();
    for (String table : expected.tables()) {
      if (!catalog.tables.containsKey(table)) {
        issues.add("Missing table: " + table);
      }
    }
    for (String index : expected.indexes()) {
      if (!catalog.indexes.contains(index)) {
        issues.add("Missing index: " + index);
      }
    }

    String ftsSql = catalog.tables.get(expected.ftsTable());
    boolean ftsEnabled = ftsSql != null;
    if (!ftsEnabled) {
      issues.add("Missing full-text search table: " + expected.ftsTable());
    } else if (!isFts5(ftsSql)) {
      issues.add("Full-text search table " + expected.ftsTable() + " is not an FTS5 virtual table");
    }
    for (String trigger : expected.ftsTriggers()) {
      if (!catalog.triggers.contains(trigger)) {
        issues.add("Missing full-text search trigger: " + trigger);
      }
    }

    ValidationReport report = ValidationReport.of(issues, catalog.userTableCount(), catalog.indexes.size(),
        ftsEnabled);
    if (report.valid()) {
      logger.info("Schema valid: " + report.tableCount() + " tables, " + report.indexCount() + " indexes");
    } else {
      logger.warning("Schema invalid: " + String.join("; ", report.issues()));
    }
    return report;
  }

  /**
   * Full catalog introspection: tables with their columns, every index (automatic
   * ones included) with its columns, views and triggers.
   */
  public SchemaInfo getSchemaInfo() {
    return manager.withConnection("schema-info", conn -> {
      Catalog catalog = readCatalog(conn);
      List<TableInfo> tables = new ArrayList<>();
      List<IndexInfo> indexes = new ArrayList<>();
      for (Map.Entry<String, String> table : catalog.tables.entrySet()) {
        String name = table.getKey();
        if (catalog.isShadowTable(name)) {
          continue;
        }
        tables.add(new TableInfo(name, isVirtual(table.getValue()), readColumns(conn, name)));
        indexes.addAll(readIndexes(conn, name));
      }
      List<ViewInfo> views = JdbcTemplate.query(conn,
          "SELECT name, sql FROM sqlite_master WHERE type = 'view' ORDER BY name",
          rs -> new ViewInfo(rs.getString("name"), rs.getString("sql")));
      List<TriggerInfo> triggers = JdbcTemplate.query(conn,
          "SELECT name, tbl_name, sql FROM sqlite_master WHERE type = 'trigger' ORDER BY name",
          rs -> new TriggerInfo(rs.getString("name"), rs.getString("tbl_name"), rs.getString("sql")));
      return new SchemaInfo(tables, indexes, views, triggers);
    });
  }

  private static Catalog readCatalog(Connection conn) {
    Catalog catalog = new Catalog();
    List<CatalogEntry> entries = JdbcTemplate.query(conn, CATALOG_SQL,
        rs -> new CatalogEntry(rs.getString("type"), rs.getString("name"), rs.getString("sql")));
    for (CatalogEntry entry : entries) {
      if (entry.name().startsWith("sqlite_")) {
        continue;
      }
      switch (entry.type()) {
        case "table" -> catalog.tables.put(entry.name(), entry.sql() == null ? "" : entry.sql());
        case "index" -> {
          // automatic indexes backing UNIQUE and PRIMARY KEY constraints have no SQL
          if (entry.sql() != null) {
            catalog.indexes.add(entry.name());
          }
        }
        case "trigger" -> catalog.triggers.add(entry.name());
        default -> {
        }
      }
    }
    return catalog;
  }

  private static List<ColumnInfo> readColumns(Connection conn, String table) {
    return JdbcTemplate.query(conn,
        "SELECT name, type, \"notnull\", dflt_value, pk FROM pragma_table_info(?) ORDER BY cid",
        rs -> new ColumnInfo(rs.getString("name"), rs.getString("type"), rs.getInt("notnull") != 0,
            rs.getString("dflt_value"), rs.getInt("pk")),
        table);
  }

  private static List<IndexInfo> readIndexes(Connection conn, String table) {
    List<IndexInfo> indexes = new ArrayList<>();
    List<IndexEntry> entries = JdbcTemplate.query(conn,
        "SELECT name, \"unique\", origin FROM pragma_index_list(?) ORDER BY name",
        rs -> new IndexEntry(rs.getString("name"), rs.getInt("unique") != 0, rs.getString("origin")),
        table);
    for (IndexEntry entry : entries) {
      List<String> columns = JdbcTemplate.query(conn,
          "SELECT name FROM pragma_index_info(?) ORDER BY seqno",
          rs -> {
            String column = rs.getString("name");
            return column == null ? "<expression>" : column;
          },
          entry.name());
      indexes.add(new IndexInfo(entry.name(), table, entry.unique(), entry.origin(), columns));
    }
    return indexes;
  }

  private static boolean isVirtual(String sql) {
    return sql.toUpperCase(Locale.ROOT).startsWith("CREATE VIRTUAL TABLE");
  }

  private static boolean isFts5(String sql) {
    return isVirtual(sql) && sql.toUpperCase(Locale.ROOT).replaceAll("\\s+", " ").contains("USING FTS5");
  }

  private record CatalogEntry(String type, String name, String sql) {
  }

  private record IndexEntry(String name, boolean unique, String origin) {
  }

  private static final class Catalog {
    private final Map<String, String> tables = new TreeMap<>();
    private final List<String> indexes = new ArrayList<>();
    private final List<String> triggers = new ArrayList<>();

    /** Tables a virtual table keeps its data in, named {@code <virtual>_<suffix>}. */
    boolean isShadowTable(String name) {
      Set<String> virtualTables = tables.entrySet().stream()
          .filter(e -> isVirtual(e.getValue()))
          .map(Map.Entry::getKey)
          .collect(Collectors.toSet());
      for (String virtual : virtualTables) {
        if (name.startsWith(virtual + "_")) {
          return true;
        }
      }
      return false;
    }

    int userTableCount() {
      int count = 0;
      for (String name : tables.keySet()) {
        if (!isShadowTable(name)) {
          count++;
        }
      }
      return count;
    }
  }
}
