package io.intellixity.catalogq.jdbc.error;

/** Coarse classification of a database failure, with the HTTP status an API reports for it. */
public enum DbErrorCategory {
  CONFLICT(409),
  CONSTRAINT(409),
  NOT_NULL(400),
  TRUNCATION(422),
  UNKNOWN_OBJECT(404),
  PERMISSION(403),
  LOGIN(401),
  TIMEOUT(503),
  CONNECTION(503),
  UNKNOWN(500);

  private final int httpStatus;

  DbErrorCategory(int httpStatus) {
    this.httpStatus = httpStatus;
  }

  public int httpStatus() { return httpStatus; }
}
