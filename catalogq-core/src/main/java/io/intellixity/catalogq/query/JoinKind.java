package io.intellixity.catalogq.query;

import java.util.Locale;

public enum JoinKind {
  INNER("INNER JOIN"),
  LEFT("LEFT JOIN"),
  RIGHT("RIGHT JOIN"),
  FULL("FULL OUTER JOIN");

  private final String sql;

  JoinKind(String sql) {
    this.sql = sql;
  }

  public String sql() { return sql; }

  /** Accepts "INNER", "inner join", "LEFT OUTER JOIN", "FULL OUTER JOIN", ... */
  public static JoinKind fromSql(String s) {
    if (s == null || s.isBlank()) return INNER;
    String t = s.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
    if (t.endsWith(" JOIN")) t = t.substring(0, t.length() - " JOIN".length());
    if (t.endsWith(" OUTER")) t = t.substring(0, t.length() - " OUTER".length());
    try {
      return JoinKind.valueOf(t);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown join type: " + s, e);
    }
  }
}
