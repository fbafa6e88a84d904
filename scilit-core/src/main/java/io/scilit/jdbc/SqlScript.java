package io.scilit.jdbc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Splits a SQL script into individual statements.
 *
 * <p>Statements end at a semicolon outside string literals, quoted identifiers
 * and comments. Inside {@code CREATE TRIGGER ... BEGIN ... END} the body's own
 * semicolons do not end the statement; {@code CASE ... END} nesting is tracked
 * so that only the {@code END} closing {@code BEGIN} counts. Comments are dropped.
 */
public final class SqlScript {
  private static final Pattern TRIGGER_HEAD =
      Pattern.compile("^CREATE\\s+(TEMP\\s+|TEMPORARY\\s+)?TRIGGER\\b.*", Pattern.DOTALL);

  private final List<String> statements;

  private SqlScript(List<String> statements) {
    this.statements = Collections.unmodifiableList(statements);
  }

  public List<String> statements() {
    return statements;
  }

  /**
   * Parses a script.
   *
   * @throws IllegalArgumentException if a string, identifier, comment, trigger body
   *     or trailing statement is left unterminated
   */
  public static SqlScript parse(String script) {
    List<String> statements = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    StringBuilder word = new StringBuilder();
    int depth = 0;
    boolean sawBegin = false;
    boolean started = false;
    int line = 1;
    int statementLine = 1;
    int length = script.length();
    int i = 0;

    while (i < length) {
      char c = script.charAt(i);

      if (c == '-' && i + 1 < length && script.charAt(i + 1) == '-') {
        int end = script.indexOf('\n', i);
        i = end < 0 ? length : end;
        continue;
      }
      if (c == '/' && i + 1 < length && script.charAt(i + 1) == '*') {
        int end = script.indexOf("*/", i + 2);
        if (end < 0) {
          throw new IllegalArgumentException("Unterminated block comment starting at line " + line);
        }
        line += countLines(script, i, end);
        current.append(' ');
        i = end + 2;
        continue;
      }
      if (c == '\'' || c == '"' || c == '`' || c == '[') {
        char close = c == '[' ? ']' : c;
        int end = findClosing(script, i + 1, close);
        if (end < 0) {
          throw new IllegalArgumentException("Unterminated quoted text starting at line " + line);
        }
        if (!started) {
          started = true;
          statementLine = line;
        }
        line += countLines(script, i, end);
        current.append(script, i, end + 1);
        i = end + 1;
        word.setLength(0);
        continue;
      }

      if (Character.isLetterOrDigit(c) || c == '_') {
        word.append(c);
      } else {
        if (word.length() > 0) {
          String keyword = word.toString().toUpperCase(Locale.ROOT);
          word.setLength(0);
          if (isTrigger(current)) {
            if (keyword.equals("BEGIN") || keyword.equals("CASE")) {
              depth++;
              sawBegin |= keyword.equals("BEGIN");
            } else if (keyword.equals("END") && depth > 0) {
              depth--;
            }
          }
        }
      }

      if (c == ';' && (!isTrigger(current) || (sawBegin && depth == 0))) {
        String sql = current.toString().trim();
        if (!sql.isEmpty()) {
          statements.add(sql);
        }
        current.setLength(0);
        depth = 0;
        sawBegin = false;
        started = false;
        i++;
        continue;
      }

      if (c == '\n') {
        line++;
      }
      if (!started && !Character.isWhitespace(c)) {
        started = true;
        statementLine = line;
      }
      current.append(c);
      i++;
    }

    String trailing = current.toString().trim();
    if (!trailing.isEmpty()) {
      if (isTrigger(current)) {
        throw new IllegalArgumentException("Unterminated trigger body starting at line " + statementLine);
      }
      throw new IllegalArgumentException("Statement starting at line " + statementLine
          + " is missing its terminating ';'");
    }
    return new SqlScript(statements);
  }

  private static boolean isTrigger(CharSequence statement) {
    String head = statement.toString().trim().toUpperCase(Locale.ROOT);
    return TRIGGER_HEAD.matcher(head).matches();
  }

  private static int findClosing(String script, int from, char close) {
    int i = from;
    while (i < script.length()) {
      if (script.charAt(i) == close) {
        // doubled quote is an escaped quote
        if (close != ']' && i + 1 < script.length() && script.charAt(i + 1) == close) {
          i += 2;
          continue;
        }
        return i;
      }
      i++;
    }
    return -1;
  }

  private static int countLines(String script, int from, int to) {
    int lines = 0;
    for (int i = from; i < to; i++) {
      if (script.charAt(i) == '\n') {
        lines++;
      }
    }
    return lines;
  }
}
