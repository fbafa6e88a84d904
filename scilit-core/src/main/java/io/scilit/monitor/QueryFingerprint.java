package io.scilit.monitor;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reduces SQL text to a fingerprint shared by every execution of the same query shape.
 *
 * <p>Comments are dropped; string, blob and numeric literals become {@code ?}, a unary
 * sign included; a parenthesized list of placeholders after {@code IN} collapses to
 * {@code in (?)}; whitespace runs collapse to one space; the result is lower-cased. Bind
 * placeholders ({@code ?}, {@code ?1}, {@code :name}) are kept as written.
 */
public final class QueryFingerprint {
  // characters after which a sign starts a literal rather than a subtraction
  private static final String UNARY_CONTEXT = "=<>!+-*/%|&~(,";
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern IN_LIST =
      Pattern.compile("\\bin\\s*\\(\\s*\\?(?:\\s*,\\s*\\?)*\\s*\\)", Pattern.CASE_INSENSITIVE);

  public static String normalize(String sql) {
    String stripped = stripLiteralsAndComments(sql);
    String collapsed = WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    collapsed = IN_LIST.matcher(collapsed).replaceAll("in (?)");
    return collapsed.toLowerCase(Locale.ROOT);
  }

  private static String stripLiteralsAndComments(String sql) {
    StringBuilder out = new StringBuilder(sql.length());
    int length = sql.length();
    int i = 0;
    while (i < length) {
      char c = sql.charAt(i);
      char next = i + 1 < length ? sql.charAt(i + 1) : '\0';

      if (c == '-' && next == '-') {
        int end = sql.indexOf('\n', i);
        i = end < 0 ? length : end;
        out.append(' ');
      } else if (c == '/' && next == '*') {
        int end = sql.indexOf("*/", i + 2);
        i = end < 0 ? length : end + 2;
        out.append(' ');
      } else if (c == '\'') {
        i = skipQuoted(sql, i + 1, '\'');
        out.append('?');
      } else if ((c == 'x' || c == 'X') && next == '\'' && !continuesWord(out)) {
        i = skipQuoted(sql, i + 2, '\'');
        out.append('?');
      } else if (c == '"' || c == '`') {
        int end = skipQuoted(sql, i + 1, c);
        out.append(sql, i, end);
        i = end;
      } else if ((c == '-' || c == '+') && isNumberStart(next, i + 2 < length ? sql.charAt(i + 2) : '\0')
          && followsOperator(out)) {
        // unary sign belongs to the literal
        i = skipNumber(sql, i + 1);
        out.append('?');
      } else if (isNumberStart(c, next) && !continuesWord(out)) {
        i = skipNumber(sql, i);
        out.append('?');
      } else {
        out.append(c);
        i++;
      }
    }
    return out.toString();
  }

  /** Returns the index just past the closing quote; doubled quotes are escapes. */
  private static int skipQuoted(String sql, int from, char quote) {
    int i = from;
    while (i < sql.length()) {
      if (sql.charAt(i) == quote) {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
          i += 2;
          continue;
        }
        return i + 1;
      }
      i++;
    }
    return sql.length();
  }

  private static boolean isNumberStart(char c, char next) {
    return Character.isDigit(c) || (c == '.' && Character.isDigit(next));
  }

  private static int skipNumber(String sql, int from) {
    int i = from;
    if (sql.startsWith("0x", i) || sql.startsWith("0X", i)) {
      i += 2;
      while (i < sql.length() && Character.digit(sql.charAt(i), 16) >= 0) {
        i++;
      }
      return i;
    }
    while (i < sql.length()) {
      char c = sql.charAt(i);
      if (Character.isDigit(c) || c == '.') {
        i++;
      } else if ((c == 'e' || c == 'E') && i + 1 < sql.length()
          && (Character.isDigit(sql.charAt(i + 1)) || sql.charAt(i + 1) == '+' || sql.charAt(i + 1) == '-')) {
        i += 2;
      } else {
        break;
      }
    }
    return i;
  }

  private static boolean followsOperator(StringBuilder out) {
    for (int i = out.length() - 1; i >= 0; i--) {
      char prev = out.charAt(i);
      if (!Character.isWhitespace(prev)) {
        return UNARY_CONTEXT.indexOf(prev) >= 0;
      }
    }
    return true;
  }

  // digits inside identifiers (t1, col_2) and numbered placeholders (?1, :p2) are not literals
  private static boolean continuesWord(StringBuilder out) {
    if (out.length() == 0) {
      return false;
    }
    char prev = out.charAt(out.length() - 1);
    return Character.isLetterOrDigit(prev) || prev == '_' || prev == '$' || prev == ':' || prev == '@'
        || prev == '?';
  }

  private QueryFingerprint() {}
}
