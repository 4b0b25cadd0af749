package io.intellixity.catalogq.jdbc;

import java.util.*;

/**
 * Rewrites SQL containing {@code @name} placeholders into JDBC SQL with '?' binds.
 *
 * Rules:
 * - Params are recognized as '@' followed by [A-Za-z_][A-Za-z0-9_]*
 * - '@@' starts a system variable (@@ROWCOUNT) and is not a param.
 * - Params inside single quotes are ignored.
 * - A name may occur more than once; it is bound at every occurrence.
 */
public final class NamedParameterSql {
  private NamedParameterSql() {}

  /** JDBC SQL plus the values to bind, in '?' order. */
  public record Compiled(String sql, List<String> names, List<Object> values) {
    public Compiled {
      names = List.copyOf(names);
      values = Collections.unmodifiableList(new ArrayList<>(values));
    }
  }

  public static Compiled compile(String sql, Map<String, ?> params) {
    Map<String, ?> effective = (params == null) ? Map.of() : params;
    List<String> names = parameterNames(sql);
    List<Object> values = new ArrayList<>(names.size());
    for (String n : names) {
      if (!effective.containsKey(n)) throw new IllegalArgumentException("Missing query param: " + n);
      values.add(effective.get(n));
    }
    return new Compiled(toJdbcSql(sql), names, values);
  }

  /** Placeholder names in order of appearance, repeats included. */
  public static List<String> parameterNames(String sql) {
    List<String> out = new ArrayList<>();
    scan(sql, null, out);
    return out;
  }

  public static String toJdbcSql(String sql) {
    StringBuilder out = new StringBuilder(sql == null ? 0 : sql.length());
    scan(sql, out, null);
    return out.toString();
  }

  private static void scan(String sql, StringBuilder out, List<String> names) {
    if (sql == null) return;
    boolean inSingleQuote = false;

    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (ch == '\'') {
        // '' escape
        if (inSingleQuote && i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
          append(out, "''");
          i++;
          continue;
        }
        inSingleQuote = !inSingleQuote;
        append(out, ch);
        continue;
      }

      if (!inSingleQuote && ch == '@') {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == '@') {
          int end = i + 2;
          while (end < sql.length() && isIdentPart(sql.charAt(end))) end++;
          append(out, sql.substring(i, end));
          i = end - 1;
          continue;
        }

        int start = i + 1;
        if (start < sql.length() && isIdentStart(sql.charAt(start))) {
          int end = start + 1;
          while (end < sql.length() && isIdentPart(sql.charAt(end))) end++;
          if (names != null) names.add(sql.substring(start, end));
          append(out, '?');
          i = end - 1;
          continue;
        }
      }

      append(out, ch);
    }
  }

  private static void append(StringBuilder out, CharSequence s) {
    if (out != null) out.append(s);
  }

  private static void append(StringBuilder out, char c) {
    if (out != null) out.append(c);
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || (c >= '0' && c <= '9');
  }
}
