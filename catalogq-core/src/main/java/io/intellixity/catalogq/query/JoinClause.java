package io.intellixity.catalogq.query;

import java.util.Objects;

/**
 * One JOIN of a query. The alias is nullable so raw client payloads can be represented; the compiler rejects
 * joins without alias.
 */
public record JoinClause(JoinKind kind, String table, String alias, ConditionGroup on) {
  public JoinClause {
    kind = (kind == null) ? JoinKind.INNER : kind;
    if (table == null || table.isBlank()) throw new IllegalArgumentException("join table must not be blank");
    table = table.trim();
    alias = (alias == null || alias.isBlank()) ? null : alias.trim();
    on = Objects.requireNonNullElse(on, new ConditionGroup(Combinator.AND, null));
  }

  public static JoinClause inner(String table, String alias, ConditionGroup on) {
    return new JoinClause(JoinKind.INNER, table, alias, on);
  }
}
