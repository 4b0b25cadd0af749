package io.intellixity.catalogq.query.builder;

public interface SelectStep {
  /** Bind the FROM table to an alias known to the schema registry. */
  JoinStep from(String table, String alias);

  /**
   * Skip FROM and JOIN entirely; the statement is meant to be compiled against a named join template that
   * supplies both.
   */
  FilterStep overTemplate();
}
