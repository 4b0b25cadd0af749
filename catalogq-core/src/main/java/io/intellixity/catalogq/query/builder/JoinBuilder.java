package io.intellixity.catalogq.query.builder;

import io.intellixity.catalogq.query.ComparisonOp;

import java.util.function.Consumer;

/**
 * ON clause of the most recently opened join. Conditions may only be added while this join is the active one;
 * opening another join or moving on to WHERE closes it.
 */
public interface JoinBuilder extends JoinStep {
  JoinBuilder onColumn(String left, ComparisonOp op, String right);

  default JoinBuilder onColumn(String left, String right) { return onColumn(left, ComparisonOp.EQ, right); }

  JoinBuilder onValue(String column, ComparisonOp op, Object value);

  JoinBuilder orOnColumn(String left, ComparisonOp op, String right);

  JoinBuilder orOnValue(String column, ComparisonOp op, Object value);

  JoinBuilder andGroup(Consumer<GroupBuilder> group);

  JoinBuilder orGroup(Consumer<GroupBuilder> group);
}
