package io.intellixity.catalogq.schema;

import io.intellixity.catalogq.query.JoinClause;
import io.intellixity.catalogq.query.TableRef;

import java.util.List;
import java.util.Objects;

/**
 * Server-defined FROM + JOIN skeleton referenced by name. Callers compiling against a template may add filters,
 * sort and paging, but cannot change its tables.
 */
public record JoinTemplate(String name, TableRef from, List<JoinClause> joins) {
  public JoinTemplate {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("template name must not be blank");
    Objects.requireNonNull(from, "from");
    joins = List.copyOf(Objects.requireNonNullElse(joins, List.of()));
  }
}
