package io.intellixity.catalogq.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.*;

/**
 * Immutable description of one SELECT statement: columns, FROM, JOINs, WHERE tree, ORDER BY and pagination.
 * <p>
 * {@code from} may be absent when the statement is compiled against a named join template or with a
 * server-pinned FROM.
 */
@JsonSerialize(using = QueryDescriptionJsonSerializer.class)
@JsonDeserialize(using = QueryDescriptionJsonDeserializer.class)
public record QueryDescription(List<String> select,
                               TableRef from,
                               List<JoinClause> joins,
                               ConditionGroup where,
                               List<SortKey> orderBy,
                               Integer limit,
                               Integer offset) {
  public QueryDescription {
    select = List.copyOf(Objects.requireNonNullElse(select, List.of()));
    joins = List.copyOf(Objects.requireNonNullElse(joins, List.of()));
    orderBy = List.copyOf(Objects.requireNonNullElse(orderBy, List.of()));
    if (limit != null && limit < 0) throw new IllegalArgumentException("limit must be >= 0");
    if (offset != null && offset < 0) throw new IllegalArgumentException("offset must be >= 0");
  }

  public boolean hasJoins() { return !joins.isEmpty(); }

  public boolean hasWhere() { return where != null && !where.isEmpty(); }
}
