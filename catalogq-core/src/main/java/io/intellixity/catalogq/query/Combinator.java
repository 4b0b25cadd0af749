package io.intellixity.catalogq.query;

import java.util.Locale;

/** Boolean connective joining the children of a {@link ConditionGroup}. */
public enum Combinator {
  AND,
  OR;

  public static Combinator parse(String s) {
    if (s == null || s.isBlank()) return AND;
    return Combinator.valueOf(s.trim().toUpperCase(Locale.ROOT));
  }
}
