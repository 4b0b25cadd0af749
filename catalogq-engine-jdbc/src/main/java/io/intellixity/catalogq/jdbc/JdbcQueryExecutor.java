package io.intellixity.catalogq.jdbc;

import io.intellixity.catalogq.jdbc.compile.SqlStatement;
import io.intellixity.catalogq.jdbc.error.DatabaseException;
import io.intellixity.catalogq.jdbc.error.SqlServerErrorMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.util.*;
import java.util.function.Function;

/**
 * Runs compiled statements. With a {@link TxHandle} the statement runs on the transaction's connection; without
 * one a connection is borrowed from the data source and closed afterwards.
 * <p>
 * Driver failures surface as {@link DatabaseException}. Parameter values are never logged.
 */
public final class JdbcQueryExecutor {
  private static final Logger log = LoggerFactory.getLogger(JdbcQueryExecutor.class);

  private final DataSource ds;
  private final SqlServerErrorMapper errors;

  public JdbcQueryExecutor(DataSource ds) {
    this(ds, new SqlServerErrorMapper());
  }

  public JdbcQueryExecutor(DataSource ds, SqlServerErrorMapper errors) {
    this.ds = Objects.requireNonNull(ds, "ds");
    this.errors = Objects.requireNonNull(errors, "errors");
  }

  public List<Map<String, Object>> execute(SqlStatement stmt, TxHandle txOrNull) {
    Objects.requireNonNull(stmt, "stmt");
    return execute(stmt.sql(), stmt.parameters(), txOrNull);
  }

  public List<Map<String, Object>> execute(String sql, Map<String, ?> parameters, TxHandle txOrNull) {
    NamedParameterSql.Compiled compiled = NamedParameterSql.compile(sql, parameters);
    try {
      Connection c = (txOrNull == null) ? ds.getConnection() : txOrNull.connection();
      try {
        long start = System.nanoTime();
        debugSql(compiled, txOrNull != null);
        try (PreparedStatement ps = c.prepareStatement(compiled.sql())) {
          bindAll(ps, compiled.values());
          try (ResultSet rs = ps.executeQuery()) {
            List<Map<String, Object>> rows = readRows(rs);
            if (log.isDebugEnabled()) {
              log.debug("catalogq.jdbc_done op=SELECT durationMs={} rows={}",
                  (System.nanoTime() - start) / 1_000_000.0, rows.size());
            }
            return rows;
          }
        }
      } finally {
        if (txOrNull == null) c.close();
      }
    } catch (SQLException e) {
      log.error("catalogq.jdbc failed sql={} params={} code={} sqlState={}",
          sql, compiled.names(), e.getErrorCode(), e.getSQLState());
      throw errors.map(e);
    }
  }

  /** Run {@code work} in a new transaction: committed when it returns, rolled back when it throws. */
  public <T> T inTx(Function<TxHandle, T> work) {
    return TransactionWrapper.run(null, ds, errors, work);
  }

  private static List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int n = md.getColumnCount();
    String[] labels = new String[n];
    for (int i = 0; i < n; i++) labels[i] = md.getColumnLabel(i + 1);

    List<Map<String, Object>> out = new ArrayList<>();
    while (rs.next()) {
      Map<String, Object> row = new LinkedHashMap<>(n * 2);
      for (int i = 0; i < n; i++) row.put(labels[i], rs.getObject(i + 1));
      out.add(row);
    }
    return out;
  }

  private static void bindAll(PreparedStatement ps, List<Object> values) throws SQLException {
    for (int i = 0; i < values.size(); i++) {
      Object v = values.get(i);
      if (v == null) ps.setNull(i + 1, Types.NULL);
      else ps.setObject(i + 1, v);
    }
  }

  private static void debugSql(NamedParameterSql.Compiled compiled, boolean inTx) {
    if (!log.isDebugEnabled()) return;
    log.debug("catalogq.jdbc op=SELECT inTx={} bindCount={} sql={}", inTx, compiled.values().size(), compiled.sql());

    // TRACE: bind summary only (no raw values; avoids PII leaks)
    if (log.isTraceEnabled()) {
      for (int i = 0; i < compiled.values().size(); i++) {
        Object v = compiled.values().get(i);
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("catalogq.jdbc bind index={} name={} valueType={} valueLen={}",
            i + 1, compiled.names().get(i), vType, vLen);
      }
    }
  }
}
