package io.intellixity.catalogq.query;

import java.util.*;

/**
 * Leaf predicate comparing a column reference ({@code status} or {@code w.status}) with a value.
 * <p>
 * IS NULL / IS NOT NULL carry no value. IN / NOT IN carry an immutable list (possibly empty); collections and
 * arrays are accepted and copied. Every other operator carries a single scalar.
 */
public final class Condition implements ConditionNode {
  private final String target;
  private final ComparisonOp operator;
  private final Object value;

  public Condition(String target, ComparisonOp operator, Object value) {
    this.target = requireTarget(target);
    this.operator = Objects.requireNonNull(operator, "operator");
    this.value = normalizeValue(operator, value, this.target);
  }

  public String target() { return target; }
  public ComparisonOp operator() { return operator; }
  public Object value() { return value; }

  /** Values of an IN / NOT IN condition. */
  @SuppressWarnings("unchecked")
  public List<Object> values() {
    if (!operator.takesList()) throw new IllegalStateException(operator + " does not carry a value list");
    return (List<Object>) value;
  }

  @Override
  public <R> R accept(ConditionVisitor<R> visitor) { return visitor.visit(this); }

  private static String requireTarget(String target) {
    if (target == null || target.isBlank()) throw new IllegalArgumentException("condition target must not be blank");
    return target.trim();
  }

  private static Object normalizeValue(ComparisonOp op, Object value, String target) {
    if (!op.takesValue()) {
      if (value != null) {
        throw new IllegalArgumentException(op.sql() + " on '" + target + "' must not carry a value");
      }
      return null;
    }
    if (op.takesList()) {
      List<Object> list = toList(value);
      if (list == null) {
        throw new IllegalArgumentException(op.sql() + " on '" + target + "' requires a list of values");
      }
      return Collections.unmodifiableList(list);
    }
    if (value instanceof Collection<?> || (value != null && value.getClass().isArray())) {
      throw new IllegalArgumentException(op.sql() + " on '" + target + "' requires a single value");
    }
    return value;
  }

  private static List<Object> toList(Object v) {
    if (v instanceof Collection<?> c) return new ArrayList<>(c);
    if (v instanceof Object[] arr) return new ArrayList<>(Arrays.asList(arr));
    if (v != null && v.getClass().isArray()) {
      int n = java.lang.reflect.Array.getLength(v);
      List<Object> out = new ArrayList<>(n);
      for (int i = 0; i < n; i++) out.add(java.lang.reflect.Array.get(v, i));
      return out;
    }
    return null;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Condition c)) return false;
    return target.equals(c.target) && operator == c.operator && Objects.equals(value, c.value);
  }

  @Override
  public int hashCode() { return Objects.hash(target, operator, value); }

  @Override
  public String toString() {
    return operator.takesValue() ? target + " " + operator.sql() + " " + value : target + " " + operator.sql();
  }
}
