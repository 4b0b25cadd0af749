package io.intellixity.catalogq.examples.service;

import io.intellixity.catalogq.jdbc.compile.CompileOptions;
import io.intellixity.catalogq.jdbc.compile.SqlCompiler;
import io.intellixity.catalogq.jdbc.compile.SqlStatement;
import io.intellixity.catalogq.query.QueryDescription;
import io.intellixity.catalogq.query.builder.Queries;
import io.intellixity.catalogq.schema.CatalogSchemas;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

final class SupplierServiceTest {
  @Test
  void availableProductsIsAnAntiJoin() {
    QueryDescription q = SupplierService.availableProductsQuery(7L, 3L);

    SqlStatement stmt = new SqlCompiler(CatalogSchemas.defaultRegistry()).compile(q);

    assertEquals("SELECT pd.product_def_id, pd.title, pd.description, pd.category_id "
        + "FROM dbo.product_definitions pd "
        + "LEFT JOIN dbo.wholesaler_item_offerings wio ON (pd.product_def_id = wio.product_def_id AND wio.wholesaler_id = @p0) "
        + "WHERE (wio.offering_id IS NULL AND pd.category_id = @p1) ORDER BY pd.title ASC", stmt.sql());
    assertEquals(Map.of("p0", 7L, "p1", 3L), stmt.parameters());
  }

  @Test
  void searchesPinTheirTable() {
    QueryService queries = mock(QueryService.class);
    SupplierService suppliers = new SupplierService(queries);
    QueryDescription payload = Queries.select("name").from("dbo.orders", "ord").build();

    suppliers.searchSuppliers(payload);
    suppliers.searchCategories(payload);

    verify(queries).withFixedFrom(SupplierService.WHOLESALERS, payload);
    verify(queries).withFixedFrom(SupplierService.CATEGORIES, payload);
  }

  @Test
  void availableProductsRunsWithoutOptions() {
    QueryService queries = mock(QueryService.class);
    new SupplierService(queries).availableProducts(1L, 2L);
    verify(queries).run(SupplierService.availableProductsQuery(1L, 2L), CompileOptions.none());
  }
}
