package io.intellixity.catalogq.query;

import java.util.*;

public final class Conditions {
  private Conditions() {}

  public static Condition eq(String column, Object value) { return new Condition(column, ComparisonOp.EQ, value); }
  public static Condition ne(String column, Object value) { return new Condition(column, ComparisonOp.NE, value); }
  public static Condition gt(String column, Object value) { return new Condition(column, ComparisonOp.GT, value); }
  public static Condition ge(String column, Object value) { return new Condition(column, ComparisonOp.GE, value); }
  public static Condition lt(String column, Object value) { return new Condition(column, ComparisonOp.LT, value); }
  public static Condition le(String column, Object value) { return new Condition(column, ComparisonOp.LE, value); }

  public static Condition in(String column, Collection<?> values) { return new Condition(column, ComparisonOp.IN, values); }
  public static Condition notIn(String column, Collection<?> values) { return new Condition(column, ComparisonOp.NOT_IN, values); }

  public static Condition like(String column, String pattern) { return new Condition(column, ComparisonOp.LIKE, pattern); }

  public static Condition isNull(String column) { return new Condition(column, ComparisonOp.IS_NULL, null); }
  public static Condition isNotNull(String column) { return new Condition(column, ComparisonOp.IS_NOT_NULL, null); }

  /** Column-to-column equality, the usual ON condition. */
  public static JoinColumnCondition columns(String left, String right) {
    return new JoinColumnCondition(left, ComparisonOp.EQ, right);
  }

  public static JoinColumnCondition columns(String left, ComparisonOp op, String right) {
    return new JoinColumnCondition(left, op, right);
  }

  public static ConditionGroup and(ConditionNode... children) {
    return ConditionGroup.of(Combinator.AND, children);
  }

  public static ConditionGroup or(ConditionNode... children) {
    return ConditionGroup.of(Combinator.OR, children);
  }
}
