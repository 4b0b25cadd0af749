package io.intellixity.catalogq.jdbc.error;

import java.sql.SQLException;
import java.util.Objects;

/**
 * The database rejected or failed a statement that passed query validation. Carries the driver's message and a
 * category so callers can tell it apart from {@link io.intellixity.catalogq.query.QueryValidationException}.
 */
public final class DatabaseException extends RuntimeException {
  private final DbErrorCategory category;
  private final int vendorCode;

  public DatabaseException(DbErrorCategory category, int vendorCode, String message, SQLException cause) {
    super(message, cause);
    this.category = Objects.requireNonNull(category, "category");
    this.vendorCode = vendorCode;
  }

  public DbErrorCategory category() { return category; }

  public int vendorCode() { return vendorCode; }

  public int httpStatus() { return category.httpStatus(); }

  @Override
  public synchronized SQLException getCause() { return (SQLException) super.getCause(); }
}
