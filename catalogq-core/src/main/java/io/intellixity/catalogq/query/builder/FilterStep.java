package io.intellixity.catalogq.query.builder;

public interface FilterStep extends OrderStep {
  /** Open the WHERE clause. May be called once per query. */
  WhereBuilder where();
}
