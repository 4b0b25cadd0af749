package io.intellixity.catalogq.jdbc;

import io.intellixity.catalogq.jdbc.error.SqlServerErrorMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.function.Function;

/**
 * Uses the caller's transaction when there is one, otherwise opens its own. begin/commit/rollback only act on a
 * transaction this wrapper opened; an external transaction is left for its owner to finish.
 *
 * <pre>{@code
 * try (TransactionWrapper tw = new TransactionWrapper(externalOrNull, ds)) {
 *   TxHandle tx = tw.begin();
 *   executor.execute(stmt, tx);
 *   tw.commit();
 * }
 * }</pre>
 *
 * Closing without commit rolls an owned transaction back.
 */
public final class TransactionWrapper implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(TransactionWrapper.class);

  private final TxHandle external;
  private final DataSource ds;
  private final SqlServerErrorMapper errors;
  private TxHandle own;
  private boolean finished;

  public TransactionWrapper(TxHandle external, DataSource ds) {
    this(external, ds, new SqlServerErrorMapper());
  }

  public TransactionWrapper(TxHandle external, DataSource ds, SqlServerErrorMapper errors) {
    if (external == null) Objects.requireNonNull(ds, "ds must be set when no external transaction is given");
    this.external = external;
    this.ds = ds;
    this.errors = Objects.requireNonNull(errors, "errors");
  }

  public boolean ownsTransaction() { return external == null; }

  /** The transaction statements should run in. Opens the owned transaction on first call. */
  public TxHandle begin() {
    if (external != null) return external;
    if (own != null) return own;
    log.debug("catalogq.tx no external transaction => begin own one");
    try {
      Connection c = ds.getConnection();
      try {
        c.setAutoCommit(false);
      } catch (SQLException e) {
        c.close();
        throw e;
      }
      own = new TxHandle(c);
      return own;
    } catch (SQLException e) {
      throw errors.map(e);
    }
  }

  public void commit() {
    if (own == null || finished) return;
    log.debug("catalogq.tx commit own transaction");
    finished = true;
    try (Connection c = own.connection()) {
      c.commit();
    } catch (SQLException e) {
      throw errors.map(e);
    }
  }

  public void rollback() {
    if (own == null || finished) return;
    log.debug("catalogq.tx rollback own transaction");
    finished = true;
    try (Connection c = own.connection()) {
      c.rollback();
    } catch (SQLException e) {
      throw errors.map(e);
    }
  }

  @Override
  public void close() {
    rollback();
  }

  /** Run {@code work} inside {@code externalOrNull} or a transaction of its own. */
  public static <T> T run(TxHandle externalOrNull, DataSource ds, SqlServerErrorMapper errors,
                          Function<TxHandle, T> work) {
    Objects.requireNonNull(work, "work");
    try (TransactionWrapper tw = new TransactionWrapper(externalOrNull, ds, errors)) {
      T result = work.apply(tw.begin());
      tw.commit();
      return result;
    }
  }
}
