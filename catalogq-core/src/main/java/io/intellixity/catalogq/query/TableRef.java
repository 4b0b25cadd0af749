package io.intellixity.catalogq.query;

/** A table as named in a query plus the alias it is bound to, e.g. {@code dbo.wholesalers w}. */
public record TableRef(String table, String alias) {
  public TableRef {
    if (table == null || table.isBlank()) throw new IllegalArgumentException("table must not be blank");
    table = table.trim();
    alias = (alias == null || alias.isBlank()) ? null : alias.trim();
  }

  public static TableRef of(String table, String alias) { return new TableRef(table, alias); }

  @Override
  public String toString() { return alias == null ? table : table + " " + alias; }
}
