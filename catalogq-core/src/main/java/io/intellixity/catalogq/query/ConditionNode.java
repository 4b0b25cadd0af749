package io.intellixity.catalogq.query;

/**
 * A node of a WHERE or ON condition tree.
 * <p>
 * The set of variants is closed: every walk over a tree goes through {@link ConditionVisitor}, which has one
 * method per variant.
 */
public sealed interface ConditionNode permits Condition, JoinColumnCondition, ConditionGroup {
  <R> R accept(ConditionVisitor<R> visitor);
}
