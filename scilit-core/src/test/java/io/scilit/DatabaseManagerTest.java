package io.scilit;

import io.scilit.jdbc.JdbcTemplate;
import io.scilit.jdbc.Row;
import io.scilit.pool.PoolStats;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseManagerTest {

  @TempDir
  Path dir;

  private DatabaseManager manager;

  @BeforeEach
  void setUp() {
    manager = new DatabaseManager(config(dir.resolve("lit.db")).build());
    manager.initialize();
  }

  @AfterEach
  void tearDown() {
    manager.close();
  }

  private static DatabaseConfig.Builder config(Path path) {
    return DatabaseConfig.builder()
        .path(path)
        .poolSize(2)
        .acquireTimeout(Duration.ofMillis(200));
  }

  @Test
  void initializeCreatesParentDirectoryAndSchema() {
    Path nested = dir.resolve("a").resolve("b").resolve("lit.db");
    try (DatabaseManager m = new DatabaseManager(config(nested).build())) {
      m.initialize();
      assertTrue(Files.isRegularFile(nested));
      assertTrue(m.isInitialized());
      assertEquals(0L, countRows(m, "authors"));
    }
  }

  @Test
  void initializeIsIdempotent() {
    manager.withTransaction("seed", conn -> JdbcTemplate.update(conn,
        "INSERT INTO authors (name) VALUES (?)", "Marie Curie"));

    manager.initialize();
    manager.initialize();

    assertTrue(manager.isInitialized());
    assertEquals(1L, countRows(manager, "authors"));
  }

  @Test
  void walModeEnabledByDefault() {
    String mode = manager.withConnection(conn ->
        JdbcTemplate.queryFirst(conn, "PRAGMA journal_mode", rs -> rs.getString(1)).orElseThrow());
    assertEquals("wal", mode.toLowerCase());
  }

  @Test
  void walModeCanBeDisabled() {
    try (DatabaseManager m = new DatabaseManager(config(dir.resolve("rollback.db")).walEnabled(false).build())) {
      m.initialize();
      String mode = m.withConnection(conn ->
          JdbcTemplate.queryFirst(conn, "PRAGMA journal_mode", rs -> rs.getString(1)).orElseThrow());
      assertEquals("delete", mode.toLowerCase());
    }
  }

  @Test
  void connectionPragmasApplied() {
    manager.withConnection("pragmas", conn -> {
      assertEquals(1, pragma(conn, "foreign_keys"));
      assertEquals(1, pragma(conn, "synchronous"));
      assertEquals(2000, pragma(conn, "cache_size"));
      assertEquals(5000, pragma(conn, "busy_timeout"));
      return null;
    });
  }

  @Test
  void failedTransactionLeavesNoAuthorThenSuccessfulOneLeavesExactlyOne() {
    assertThrows(IllegalStateException.class, () -> manager.withTransaction("add-author", conn -> {
      JdbcTemplate.update(conn, "INSERT INTO authors (name, email) VALUES (?, ?)", "Ada Lovelace", "ada@example.org");
      throw new IllegalStateException("boom");
    }));
    assertEquals(0L, countRows(manager, "authors"));

    manager.withTransaction("add-author", conn -> JdbcTemplate.update(conn,
        "INSERT INTO authors (name, email) VALUES (?, ?)", "Ada Lovelace", "ada@example.org"));
    assertEquals(1L, countRows(manager, "authors"));
  }

  @Test
  void failedTransactionRestoresPreviousStateExactly() {
    manager.withTransaction("seed", conn -> {
      JdbcTemplate.update(conn, "INSERT INTO papers (title, paper_type) VALUES (?, ?)", "Solid electrolytes", "journal");
      JdbcTemplate.update(conn, "INSERT INTO authors (name) VALUES (?)", "John Goodenough");
      return null;
    });
    List<Row> papersBefore = snapshot("papers");
    List<Row> authorsBefore = snapshot("authors");

    assertThrows(StoreException.class, () -> manager.withTransaction("mixed", conn -> {
      JdbcTemplate.update(conn, "UPDATE papers SET citation_count = citation_count + 10");
      JdbcTemplate.update(conn, "INSERT INTO authors (name) VALUES (?)", "Akira Yoshino");
      JdbcTemplate.update(conn, "DELETE FROM authors WHERE name = ?", "John Goodenough");
      // violates the paper_type CHECK constraint
      JdbcTemplate.update(conn, "INSERT INTO papers (title, paper_type) VALUES (?, ?)", "Bad", "blog");
      return null;
    }));

    assertEquals(papersBefore, snapshot("papers"));
    assertEquals(authorsBefore, snapshot("authors"));
  }

  @Test
  void committedWritesVisibleToFreshConnection() throws SQLException {
    manager.withTransaction("add-dataset", conn -> JdbcTemplate.update(conn,
        "INSERT INTO datasets (name, format) VALUES (?, ?)", "NASA battery cycling", "csv"));

    try (Connection fresh = DriverManager.getConnection(manager.config().jdbcUrl());
         Statement st = fresh.createStatement();
         ResultSet rs = st.executeQuery("SELECT name FROM datasets")) {
      assertTrue(rs.next());
      assertEquals("NASA battery cycling", rs.getString(1));
      assertFalse(rs.next());
    }
  }

  @Test
  void scopesReleaseConnectionExactlyOnceOnEveryExitPath() {
    long acquiredBefore = manager.poolStats().totalAcquired();

    manager.withConnection(conn -> 1);
    assertAllIdle();

    assertThrows(IllegalArgumentException.class, () -> manager.withConnection(conn -> {
      throw new IllegalArgumentException("fail");
    }));
    assertAllIdle();

    manager.withTransaction(conn -> "early");
    assertAllIdle();

    assertThrows(IllegalArgumentException.class, () -> manager.withTransaction(conn -> {
      throw new IllegalArgumentException("fail");
    }));
    assertAllIdle();

    assertEquals(acquiredBefore + 4, manager.poolStats().totalAcquired());
  }

  @Test
  void checkedExceptionReachesCallerUnchanged() {
    IOException original = new IOException("disk gone");
    IOException thrown = assertThrows(IOException.class, () -> manager.withConnection("read-file", conn -> {
      throw original;
    }));
    assertSame(original, thrown);

    SQLException sql = new SQLException("nope");
    assertSame(sql, assertThrows(SQLException.class, () -> manager.withTransaction("tx", conn -> {
      throw sql;
    })));
    assertAllIdle();
  }

  @Test
  void withConnectionRollsBackTransactionOpenedInsideScope() throws SQLException {
    assertThrows(IllegalStateException.class, () -> manager.withConnection("manual-tx", conn -> {
      conn.setAutoCommit(false);
      JdbcTemplate.update(conn, "INSERT INTO authors (name) VALUES (?)", "Dorothy Hodgkin");
      throw new IllegalStateException("abort");
    }));

    assertEquals(0L, countRows(manager, "authors"));
    assertTrue(manager.withConnection(Connection::getAutoCommit));
  }

  @Test
  void failedScopeRollsBackTransactionOpenedWithPlainBegin() throws SQLException {
    Path path = dir.resolve("raw-begin.db");
    try (DatabaseManager single = new DatabaseManager(config(path).poolSize(1).build())) {
      single.initialize();

      assertThrows(IllegalStateException.class, () -> single.withConnection("raw-begin", conn -> {
        try (Statement st = conn.createStatement()) {
          st.execute("BEGIN");
          st.executeUpdate("INSERT INTO authors (name) VALUES ('ghost')");
        }
        throw new IllegalStateException("abort");
      }));

      assertEquals(0L, countRows(single, "authors"));
      try (Connection fresh = DriverManager.getConnection("jdbc:sqlite:" + path);
           Statement st = fresh.createStatement()) {
        assertEquals(1, st.executeUpdate("INSERT INTO authors (name) VALUES ('Lise Meitner')"));
      }
      single.withTransaction("next", conn -> JdbcTemplate.update(conn,
          "INSERT INTO authors (name) VALUES (?)", "Emmy Noether"));
      assertEquals(2L, countRows(single, "authors"));
      assertEquals(1, single.poolStats().idle());
    }
  }

  @Test
  void nestedTransactionOnSameThreadIsRejected() {
    manager.withTransaction("outer", conn -> {
      assertTrue(manager.inTransaction());
      TransactionAlreadyOpenException e = assertThrows(TransactionAlreadyOpenException.class,
          () -> manager.withTransaction("inner", inner -> null));
      assertTrue(e.getMessage().contains("outer"));
      JdbcTemplate.update(conn, "INSERT INTO authors (name) VALUES (?)", "Lise Meitner");
      return null;
    });

    assertFalse(manager.inTransaction());
    assertEquals(1L, countRows(manager, "authors"));
    manager.withTransaction("after", conn -> null);
  }

  @Test
  void transactionGuardRollsBackWhenNotCommitted() {
    DatabaseManager.Transaction tx = manager.begin("guard");
    try (tx) {
      JdbcTemplate.update(tx.connection(), "INSERT INTO authors (name) VALUES (?)", "Chien-Shiung Wu");
      assertEquals(TransactionState.BEGUN, tx.state());
    }

    assertEquals(TransactionState.ROLLED_BACK, tx.state());
    assertEquals(0L, countRows(manager, "authors"));
    assertThrows(IllegalStateException.class, tx::connection);
    assertAllIdle();
  }

  @Test
  void transactionGuardCommit() {
    DatabaseManager.Transaction tx = manager.begin("guard");
    try (tx) {
      JdbcTemplate.update(tx.connection(), "INSERT INTO authors (name) VALUES (?)", "Emmy Noether");
      tx.commit();
      tx.commit();
      assertEquals(TransactionState.COMMITTED, tx.state());
    }
    tx.close();

    assertEquals(1L, countRows(manager, "authors"));
    assertEquals(TransactionState.COMMITTED, tx.state());
    assertAllIdle();
  }

  @Test
  void commitAfterRollbackIsRejected() {
    try (DatabaseManager.Transaction tx = manager.begin("guard")) {
      tx.rollback();
      assertThrows(IllegalStateException.class, tx::commit);
    }
  }

  @Test
  void constraintViolationIsClassified() {
    manager.withTransaction(conn -> JdbcTemplate.update(conn,
        "INSERT INTO authors (name, email) VALUES (?, ?)", "A", "same@example.org"));

    StoreException e = assertThrows(StoreException.class, () -> manager.withTransaction(conn -> JdbcTemplate.update(
        conn, "INSERT INTO authors (name, email) VALUES (?, ?)", "B", "same@example.org")));
    assertEquals(ErrorKind.CONSTRAINT, ErrorKind.of(e));
  }

  @Test
  void foreignKeysAreEnforced() {
    StoreException e = assertThrows(StoreException.class, () -> manager.withTransaction(conn -> JdbcTemplate.update(
        conn, "INSERT INTO paper_authors (paper_id, author_id, author_position) VALUES (?, ?, ?)", 42, 42, 1)));
    assertEquals(ErrorKind.CONSTRAINT, ErrorKind.of(e));
  }

  @Test
  void fullTextIndexFollowsPaperChanges() {
    long id = manager.withTransaction(conn -> {
      JdbcTemplate.update(conn, "INSERT INTO papers (title, abstract) VALUES (?, ?)",
          "Lithium dendrite suppression", "Solid electrolyte interphase engineering");
      return JdbcTemplate.queryFirst(conn, "SELECT last_insert_rowid()", rs -> rs.getLong(1)).orElseThrow();
    });
    assertEquals(1, ftsMatches("dendrite"));

    manager.withTransaction(conn -> JdbcTemplate.update(conn,
        "UPDATE papers SET title = ? WHERE id = ?", "Sodium anode stability", id));
    assertEquals(0, ftsMatches("dendrite"));
    assertEquals(1, ftsMatches("sodium"));

    manager.withTransaction(conn -> JdbcTemplate.update(conn, "DELETE FROM papers WHERE id = ?", id));
    assertEquals(0, ftsMatches("sodium"));
  }

  @Test
  void poolExhaustionSurfacesToCaller() {
    try (DatabaseManager single = new DatabaseManager(config(dir.resolve("single.db")).poolSize(1).build())) {
      single.initialize();
      assertThrows(PoolExhaustedException.class, () -> single.withConnection("outer",
          outer -> single.withConnection("inner", inner -> null)));
      assertEquals(1, single.poolStats().idle());
    }
  }

  @Test
  void closedManagerRefusesWork() {
    manager.close();
    assertThrows(PoolClosedException.class, () -> manager.withConnection(conn -> null));
    assertThrows(PoolClosedException.class, () -> manager.begin("late"));
  }

  @Test
  void schemaNextToDatabaseFileIsPreferredOverBundledScript() throws IOException {
    Path sub = Files.createDirectories(dir.resolve("custom"));
    Files.writeString(sub.resolve("schema.sql"), "CREATE TABLE IF NOT EXISTS notes (id INTEGER PRIMARY KEY, body TEXT);\n");

    try (DatabaseManager m = new DatabaseManager(config(sub.resolve("lit.db")).build())) {
      m.initialize();
      assertEquals(0L, countRows(m, "notes"));
      assertFalse(tableExists(m, "authors"));
    }
  }

  @Test
  void failingSchemaIsRolledBackAndNotRetried() throws IOException {
    Path script = Files.writeString(dir.resolve("broken.sql"),
        "CREATE TABLE first_table (id INTEGER);\nCREATE TABLE first_table (id INTEGER);\n");

    try (DatabaseManager m = new DatabaseManager(config(dir.resolve("broken.db")).schemaScript(script).build())) {
      SchemaInitException first = assertThrows(SchemaInitException.class, m::initialize);
      assertTrue(first.getMessage().contains("statement 2"), first.getMessage());
      assertFalse(m.isInitialized());
      assertFalse(tableExists(m, "first_table"));

      Files.writeString(script, "CREATE TABLE first_table (id INTEGER);\n");
      SchemaInitException again = assertThrows(SchemaInitException.class, m::initialize);
      assertSame(first, again.getCause());
      assertFalse(tableExists(m, "first_table"));
    }
  }

  @Test
  void unparsableSchemaFailsInitialization() throws IOException {
    Path script = Files.writeString(dir.resolve("unterminated.sql"),
        "CREATE TABLE ok (id INTEGER);\nCREATE TRIGGER t AFTER INSERT ON ok BEGIN\n  DELETE FROM ok;\n");

    try (DatabaseManager m = new DatabaseManager(config(dir.resolve("u.db")).schemaScript(script).build())) {
      SchemaInitException e = assertThrows(SchemaInitException.class, m::initialize);
      assertInstanceOf(IllegalArgumentException.class, e.getCause());
    }
  }

  @Test
  void missingSchemaScriptFailsInitialization() {
    Path missing = dir.resolve("does-not-exist.sql");
    try (DatabaseManager m = new DatabaseManager(config(dir.resolve("m.db")).schemaScript(missing).build())) {
      SchemaInitException e = assertThrows(SchemaInitException.class, m::initialize);
      assertInstanceOf(IOException.class, e.getCause());
    }
  }

  private void assertAllIdle() {
    PoolStats stats = manager.poolStats();
    assertEquals(0, stats.checkedOut(), stats.toString());
    assertEquals(stats.size(), stats.idle(), stats.toString());
  }

  private List<Row> snapshot(String table) {
    return manager.withConnection(conn -> JdbcTemplate.queryRows(conn, "SELECT * FROM " + table + " ORDER BY id"));
  }

  private int ftsMatches(String term) {
    return manager.withConnection(conn -> JdbcTemplate.queryFirst(conn,
        "SELECT COUNT(*) FROM papers_fts WHERE papers_fts MATCH ?", rs -> rs.getInt(1), term).orElseThrow());
  }

  private static long countRows(DatabaseManager m, String table) {
    return m.withConnection(conn -> JdbcTemplate.queryFirst(conn,
        "SELECT COUNT(*) FROM " + table, rs -> rs.getLong(1)).orElseThrow());
  }

  private static boolean tableExists(DatabaseManager m, String table) {
    return m.withConnection(conn -> JdbcTemplate.queryFirst(conn,
        "SELECT 1 FROM sqlite_master WHERE type = 'table' AND name = ?", rs -> true, table).isPresent());
  }

  private static int pragma(Connection conn, String name) {
    return JdbcTemplate.queryFirst(conn, "PRAGMA " + name, rs -> rs.getInt(1)).orElseThrow();
  }
}
