package io.intellixity.catalogq.schema;

import java.util.*;

/**
 * Allow-list entry: the table an alias is bound to and the columns that may be referenced through it.
 */
public record TableDefinition(String alias, String schemaName, String tableName, Set<String> columns) {
  public TableDefinition {
    if (alias == null || alias.isBlank()) throw new IllegalArgumentException("alias must not be blank");
    if (tableName == null || tableName.isBlank()) throw new IllegalArgumentException("tableName must not be blank");
    schemaName = (schemaName == null || schemaName.isBlank()) ? null : schemaName;
    columns = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNullElse(columns, Set.of())));
  }

  public static TableDefinition of(String alias, String schemaName, String tableName, String... columns) {
    return new TableDefinition(alias, schemaName, tableName, new LinkedHashSet<>(Arrays.asList(columns)));
  }

  /** {@code schema.table}, or the bare table name when no schema is set. */
  public String qualifiedName() {
    return schemaName == null ? tableName : schemaName + "." + tableName;
  }

  /** True when {@code table} names this definition, either schema-qualified or bare. */
  public boolean matchesTable(String table) {
    if (table == null) return false;
    return table.equals(qualifiedName()) || table.equals(tableName);
  }

  public boolean hasColumn(String column) { return columns.contains(column); }
}
