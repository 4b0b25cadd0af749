package io.intellixity.catalogq.query;

import java.util.Objects;

/**
 * Raised when a query description references identifiers outside the allow-list, is structurally incomplete,
 * or when a builder is used out of order.
 * <p>
 * These are programming or configuration errors: they are detected before any SQL reaches the database and are
 * never retried.
 */
public final class QueryValidationException extends RuntimeException {
  public enum Reason {
    UNKNOWN_ALIAS,
    ALIAS_TABLE_MISMATCH,
    UNKNOWN_COLUMN,
    AMBIGUOUS_UNQUALIFIED_COLUMN,
    MISSING_REQUIRED_CLAUSE,
    ANONYMOUS_JOIN,
    UNSUPPORTED_CONDITION_NODE,
    BUILDER_MISUSE,
    UNKNOWN_TEMPLATE,
    TEMPLATE_VIOLATION
  }

  private final Reason reason;

  public QueryValidationException(Reason reason, String message) {
    super(message);
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  public QueryValidationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  public Reason reason() { return reason; }
}
