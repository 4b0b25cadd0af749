package io.intellixity.catalogq.query;

public interface ConditionVisitor<R> {
  R visit(Condition condition);
  R visit(JoinColumnCondition condition);
  R visit(ConditionGroup group);
}
