package io.intellixity.catalogq.query.builder;

import io.intellixity.catalogq.query.Combinator;
import io.intellixity.catalogq.query.ConditionGroup;
import io.intellixity.catalogq.query.ConditionNode;

import java.util.*;
import java.util.function.Consumer;

/** Mutable group under construction. An OR append switches the whole group to OR. */
final class GroupDraft {
  private Combinator combinator = Combinator.AND;
  private final List<ConditionNode> children = new ArrayList<>();

  void append(Combinator connective, ConditionNode node) {
    if (connective == Combinator.OR) combinator = Combinator.OR;
    children.add(Objects.requireNonNull(node, "node"));
  }

  boolean isEmpty() { return children.isEmpty(); }

  ConditionGroup toGroup() { return new ConditionGroup(combinator, children); }

  /** Run {@code body} against a fresh child group (combinator AND until an OR is appended). */
  static ConditionGroup nested(Consumer<GroupBuilder> body, boolean columnConditions) {
    Objects.requireNonNull(body, "group");
    GroupBuilder b = new GroupBuilder(columnConditions);
    body.accept(b);
    return b.close();
  }
}
