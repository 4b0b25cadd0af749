package io.intellixity.catalogq.schema;

import io.intellixity.catalogq.query.QueryValidationException;

import java.util.Optional;
import java.util.Set;

/**
 * Alias-keyed allow-list of queryable tables and columns.
 * <p>
 * Populated once at startup and read-only afterwards. Every identifier that reaches generated SQL is checked
 * against this registry.
 */
public interface SchemaRegistry {
  Optional<TableDefinition> lookup(String alias);

  /** All registered aliases, in registration order. */
  Set<String> aliases();

  default TableDefinition require(String alias) {
    return lookup(alias).orElseThrow(() -> new QueryValidationException(
        QueryValidationException.Reason.UNKNOWN_ALIAS,
        "Alias '" + alias + "' is not defined in the schema registry. Available aliases: " + String.join(", ", aliases())
    ));
  }

  default Set<String> columnsOf(String alias) {
    return require(alias).columns();
  }
}
