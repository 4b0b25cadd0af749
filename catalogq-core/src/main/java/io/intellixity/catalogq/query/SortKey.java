package io.intellixity.catalogq.query;

import java.util.Locale;
import java.util.Objects;

public record SortKey(String target, Direction direction) {
  public SortKey {
    Objects.requireNonNull(target, "target");
    target = target.trim();
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public static SortKey asc(String target) { return new SortKey(target, Direction.ASC); }
  public static SortKey desc(String target) { return new SortKey(target, Direction.DESC); }

  public enum Direction {
    ASC, DESC;

    public static Direction parse(String s) {
      if (s == null || s.isBlank()) return ASC;
      return Direction.valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
  }
}
