package io.intellixity.catalogq.query.builder;

import io.intellixity.catalogq.query.*;

import java.util.function.Consumer;

/**
 * Nested group handed to {@code andGroup}/{@code orGroup} callbacks. Follows the same AND/OR rules as
 * {@link WhereBuilder} and is closed once the callback returns.
 */
public final class GroupBuilder {
  private final GroupDraft draft = new GroupDraft();
  private final boolean columnConditions;
  private boolean open = true;

  GroupBuilder(boolean columnConditions) {
    this.columnConditions = columnConditions;
  }

  public GroupBuilder and(String column, ComparisonOp op, Object value) {
    return append(Combinator.AND, new Condition(column, op, value));
  }

  public GroupBuilder and(String column, ComparisonOp op) { return and(column, op, null); }

  public GroupBuilder or(String column, ComparisonOp op, Object value) {
    return append(Combinator.OR, new Condition(column, op, value));
  }

  public GroupBuilder or(String column, ComparisonOp op) { return or(column, op, null); }

  /** Column-to-column comparison; only available inside ON clauses. */
  public GroupBuilder andColumns(String left, ComparisonOp op, String right) {
    return append(Combinator.AND, columnCondition(left, op, right));
  }

  public GroupBuilder orColumns(String left, ComparisonOp op, String right) {
    return append(Combinator.OR, columnCondition(left, op, right));
  }

  public GroupBuilder andGroup(Consumer<GroupBuilder> group) {
    ensureOpen();
    return append(Combinator.AND, GroupDraft.nested(group, columnConditions));
  }

  public GroupBuilder orGroup(Consumer<GroupBuilder> group) {
    ensureOpen();
    return append(Combinator.OR, GroupDraft.nested(group, columnConditions));
  }

  ConditionGroup close() {
    ensureOpen();
    open = false;
    return draft.toGroup();
  }

  private JoinColumnCondition columnCondition(String left, ComparisonOp op, String right) {
    if (!columnConditions) {
      throw new QueryValidationException(QueryValidationException.Reason.UNSUPPORTED_CONDITION_NODE,
          "Column-to-column conditions are only allowed in ON clauses: " + left + " " + op.sql() + " " + right);
    }
    return new JoinColumnCondition(left, op, right);
  }

  private GroupBuilder append(Combinator connective, ConditionNode node) {
    ensureOpen();
    draft.append(connective, node);
    return this;
  }

  private void ensureOpen() {
    if (!open) {
      throw new QueryValidationException(QueryValidationException.Reason.BUILDER_MISUSE,
          "Group builder used after its callback returned");
    }
  }
}
