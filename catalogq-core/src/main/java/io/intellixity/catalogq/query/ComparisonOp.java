package io.intellixity.catalogq.query;

import java.util.Locale;

public enum ComparisonOp {
  EQ("="),
  NE("!="),
  GT(">"),
  LT("<"),
  GE(">="),
  LE("<="),

  IN("IN"),
  NOT_IN("NOT IN"),

  LIKE("LIKE"),

  IS_NULL("IS NULL"),
  IS_NOT_NULL("IS NOT NULL");

  private final String sql;

  ComparisonOp(String sql) {
    this.sql = sql;
  }

  /** SQL token rendered between the operands. */
  public String sql() { return sql; }

  /** False for IS NULL / IS NOT NULL, which never bind a parameter. */
  public boolean takesValue() { return this != IS_NULL && this != IS_NOT_NULL; }

  public boolean takesList() { return this == IN || this == NOT_IN; }

  /**
   * Parse either the SQL token ("=", "NOT IN", "<>") or the constant name ("EQ", "not_in").
   */
  public static ComparisonOp fromSql(String token) {
    if (token == null) throw new IllegalArgumentException("operator must not be null");
    String t = token.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
    if (t.equals("<>")) return NE;
    for (ComparisonOp op : values()) {
      if (op.sql.equals(t) || op.name().equals(t.replace(' ', '_'))) return op;
    }
    throw new IllegalArgumentException("Unknown comparison operator: " + token);
  }
}
