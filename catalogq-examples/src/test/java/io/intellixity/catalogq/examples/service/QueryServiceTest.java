package io.intellixity.catalogq.examples.service;

import io.intellixity.catalogq.jdbc.JdbcQueryExecutor;
import io.intellixity.catalogq.jdbc.compile.SqlCompiler;
import io.intellixity.catalogq.jdbc.compile.SqlStatement;
import io.intellixity.catalogq.query.ComparisonOp;
import io.intellixity.catalogq.query.QueryDescription;
import io.intellixity.catalogq.query.QueryValidationException;
import io.intellixity.catalogq.query.builder.Queries;
import io.intellixity.catalogq.schema.CatalogSchemas;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

final class QueryServiceTest {
  private JdbcQueryExecutor executor;
  private QueryService service;

  @BeforeEach
  void setup() {
    executor = mock(JdbcQueryExecutor.class);
    when(executor.execute(any(SqlStatement.class), isNull())).thenReturn(List.of(Map.of("name", "Acme")));
    service = new QueryService(new SqlCompiler(CatalogSchemas.defaultRegistry(), CatalogSchemas.defaultTemplates()),
        executor);
  }

  @Test
  void standardRequiresFrom() {
    QueryDescription noFrom = Queries.select("w.name").overTemplate().build();

    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> service.standard(noFrom));
    assertEquals(QueryValidationException.Reason.MISSING_REQUIRED_CLAUSE, ex.reason());
    assertThrows(QueryValidationException.class, () -> service.standard(null));
    verifyNoInteractions(executor);
  }

  @Test
  void predefinedRunsAgainstTemplate() {
    QueryDescription q = Queries.select("wio.title", "wol.url").overTemplate()
        .where().and("wio.wholesaler_id", ComparisonOp.EQ, 5)
        .build();

    QueryResult r = service.predefined("offering_links", q);

    ArgumentCaptor<SqlStatement> sent = ArgumentCaptor.forClass(SqlStatement.class);
    verify(executor).execute(sent.capture(), isNull());
    assertEquals("SELECT wio.title, wol.url FROM dbo.wholesaler_item_offerings wio "
        + "INNER JOIN dbo.wholesaler_offering_links wol ON (wio.offering_id = wol.offering_id) "
        + "WHERE (wio.wholesaler_id = @p0)", sent.getValue().sql());
    assertEquals(1, r.rows().size());
    assertSame(sent.getValue(), r.statement());
  }

  @Test
  void validationFailuresNeverReachTheDatabase() {
    QueryDescription q = Queries.select("w.password").from("dbo.wholesalers", "w").build();
    assertThrows(QueryValidationException.class, () -> service.standard(q));
    verifyNoInteractions(executor);
  }
}
