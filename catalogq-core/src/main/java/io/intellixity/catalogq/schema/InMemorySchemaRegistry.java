package io.intellixity.catalogq.schema;

import java.util.*;

/** Immutable {@link SchemaRegistry} built from a fixed list of definitions. */
public final class InMemorySchemaRegistry implements SchemaRegistry {
  private final Map<String, TableDefinition> byAlias;

  public InMemorySchemaRegistry(Collection<TableDefinition> tables) {
    Map<String, TableDefinition> m = new LinkedHashMap<>();
    for (TableDefinition t : Objects.requireNonNull(tables, "tables")) {
      TableDefinition prev = m.putIfAbsent(t.alias(), t);
      if (prev != null) {
        throw new IllegalArgumentException("Duplicate alias '" + t.alias() + "' for tables '"
            + prev.qualifiedName() + "' and '" + t.qualifiedName() + "'");
      }
    }
    this.byAlias = Collections.unmodifiableMap(m);
  }

  public static InMemorySchemaRegistry of(TableDefinition... tables) {
    return new InMemorySchemaRegistry(List.of(tables));
  }

  @Override
  public Optional<TableDefinition> lookup(String alias) {
    if (alias == null) return Optional.empty();
    return Optional.ofNullable(byAlias.get(alias));
  }

  @Override
  public Set<String> aliases() { return byAlias.keySet(); }
}
