package io.intellixity.catalogq.examples.service;

import io.intellixity.catalogq.jdbc.JdbcQueryExecutor;
import io.intellixity.catalogq.jdbc.compile.CompileOptions;
import io.intellixity.catalogq.jdbc.compile.SqlCompiler;
import io.intellixity.catalogq.jdbc.compile.SqlStatement;
import io.intellixity.catalogq.query.QueryDescription;
import io.intellixity.catalogq.query.QueryValidationException;
import io.intellixity.catalogq.query.TableRef;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/** Compiles client query descriptions and runs them outside any transaction. */
@Service
public final class QueryService {
  private static final QueryDescription EMPTY = new QueryDescription(null, null, null, null, null, null, null);

  private final SqlCompiler compiler;
  private final JdbcQueryExecutor executor;

  public QueryService(SqlCompiler compiler, JdbcQueryExecutor executor) {
    this.compiler = compiler;
    this.executor = executor;
  }

  /** Fully dynamic FROM taken from the payload. */
  public QueryResult standard(QueryDescription payload) {
    if (payload == null || payload.from() == null) {
      throw new QueryValidationException(QueryValidationException.Reason.MISSING_REQUIRED_CLAUSE,
          "The 'from' field is required in the payload for a standard query request.");
    }
    return run(payload, CompileOptions.none());
  }

  /** FROM and JOINs come from the named join template; the payload contributes columns, filters and paging. */
  public QueryResult predefined(String namedQuery, QueryDescription payload) {
    return run(payload == null ? EMPTY : payload, CompileOptions.namedTemplate(namedQuery));
  }

  /** FROM pinned by the endpoint; whatever the payload says about FROM is overridden. */
  public QueryResult withFixedFrom(TableRef from, QueryDescription payload) {
    return run(payload == null ? EMPTY : payload, CompileOptions.fixedFrom(from));
  }

  public QueryResult run(QueryDescription q, CompileOptions options) {
    SqlStatement stmt = compiler.compile(q, options);
    List<Map<String, Object>> rows = executor.execute(stmt, null);
    return new QueryResult(rows, stmt);
  }
}
