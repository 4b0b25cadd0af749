package io.intellixity.catalogq.jdbc;

import java.sql.Connection;
import java.util.Objects;

/** A connection with auto-commit off, owned by whoever began the transaction. */
public record TxHandle(Connection connection) {
  public TxHandle {
    Objects.requireNonNull(connection, "connection");
  }
}
