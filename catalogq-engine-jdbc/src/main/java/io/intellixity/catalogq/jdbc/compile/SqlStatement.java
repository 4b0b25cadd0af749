package io.intellixity.catalogq.jdbc.compile;

import java.util.*;

/**
 * Compiled statement: SQL text with {@code @pN} placeholders and the values bound to them, in placeholder order.
 * Parameter values may be null.
 */
public record SqlStatement(String sql, Map<String, Object> parameters, QueryMetadata metadata) {
  public SqlStatement {
    Objects.requireNonNull(sql, "sql");
    parameters = (parameters == null)
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
  }
}
