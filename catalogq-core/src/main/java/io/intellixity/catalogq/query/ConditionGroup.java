package io.intellixity.catalogq.query;

import java.util.List;
import java.util.Objects;

/**
 * Children joined by one combinator. Rendered inside a single pair of parentheses; nesting is the only way to
 * mix AND and OR.
 */
public record ConditionGroup(Combinator combinator, List<ConditionNode> children) implements ConditionNode {
  public ConditionGroup {
    combinator = (combinator == null) ? Combinator.AND : combinator;
    children = List.copyOf(Objects.requireNonNullElse(children, List.of()));
  }

  public static ConditionGroup of(Combinator combinator, ConditionNode... children) {
    return new ConditionGroup(combinator, List.of(children));
  }

  public boolean isEmpty() { return children.isEmpty(); }

  @Override
  public <R> R accept(ConditionVisitor<R> visitor) { return visitor.visit(this); }
}
