package io.intellixity.catalogq.query.builder;

import java.util.*;

/**
 * Entry point of the fluent query builder.
 *
 * <pre>{@code
 * QueryDescription q = Queries.select("w.name", "pc.name AS category_name")
 *     .from("dbo.wholesalers", "w")
 *     .innerJoin("dbo.product_categories", "pc").onColumn("w.category_id", "pc.category_id")
 *     .where().and("w.status", ComparisonOp.EQ, "active")
 *     .orderBy("w.name")
 *     .limit(20).offset(0)
 *     .build();
 * }</pre>
 *
 * Builders are single-use and not thread-safe.
 */
public final class Queries {
  private Queries() {}

  public static SelectStep select(String... columns) {
    return select(Arrays.asList(Objects.requireNonNull(columns, "columns")));
  }

  public static SelectStep select(List<String> columns) {
    Objects.requireNonNull(columns, "columns");
    List<String> out = new ArrayList<>(columns.size());
    for (String c : columns) {
      if (c == null || c.isBlank()) throw new IllegalArgumentException("select column must not be blank");
      out.add(c.trim());
    }
    return new QueryDraft(List.copyOf(out));
  }
}
