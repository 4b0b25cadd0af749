package io.intellixity.catalogq.query.builder;

import io.intellixity.catalogq.query.ComparisonOp;

import java.util.function.Consumer;

/**
 * Top-level WHERE group.
 * <p>
 * {@code and} appends a sibling. {@code or} switches the whole group to OR and appends a sibling, so
 * {@code and(a).or(b).or(c)} and {@code and(a).and(b).or(c)} both yield {@code (a OR b OR c)}. Use
 * {@link #andGroup} / {@link #orGroup} to mix connectives.
 */
public interface WhereBuilder extends OrderStep {
  WhereBuilder and(String column, ComparisonOp op, Object value);

  /** For IS NULL / IS NOT NULL. */
  WhereBuilder and(String column, ComparisonOp op);

  WhereBuilder or(String column, ComparisonOp op, Object value);

  WhereBuilder or(String column, ComparisonOp op);

  WhereBuilder andGroup(Consumer<GroupBuilder> group);

  WhereBuilder orGroup(Consumer<GroupBuilder> group);
}
