package io.intellixity.catalogq.query;

import java.util.Objects;

/** Column-to-column comparison, e.g. {@code w.wholesaler_id = wc.wholesaler_id}. Never binds a parameter. */
public record JoinColumnCondition(String left, ComparisonOp operator, String right) implements ConditionNode {
  public JoinColumnCondition {
    if (left == null || left.isBlank()) throw new IllegalArgumentException("left column must not be blank");
    if (right == null || right.isBlank()) throw new IllegalArgumentException("right column must not be blank");
    Objects.requireNonNull(operator, "operator");
    if (!operator.takesValue() || operator.takesList()) {
      throw new IllegalArgumentException("Operator " + operator.sql() + " cannot compare two columns");
    }
    left = left.trim();
    right = right.trim();
  }

  @Override
  public <R> R accept(ConditionVisitor<R> visitor) { return visitor.visit(this); }
}
