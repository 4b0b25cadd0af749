package io.intellixity.catalogq.examples.web;

import io.intellixity.catalogq.examples.service.QueryResult;
import io.intellixity.catalogq.examples.service.SupplierService;
import io.intellixity.catalogq.jdbc.compile.QueryMetadata;
import io.intellixity.catalogq.jdbc.compile.SqlStatement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

final class SupplierControllerTest {
  private SupplierService suppliers;
  private MockMvc mvc;

  @BeforeEach
  void setup() {
    suppliers = mock(SupplierService.class);
    mvc = MockMvcBuilders.standaloneSetup(new SupplierController(suppliers), new CategoryController(suppliers))
        .setControllerAdvice(new ApiExceptionHandler())
        .build();
  }

  private static QueryResult rows(String resolvedFrom, Map<String, Object> row) {
    SqlStatement stmt = new SqlStatement("SELECT 1", Map.of(),
        new QueryMetadata(List.copyOf(row.keySet()), false, false, 0, resolvedFrom));
    return new QueryResult(List.of(row), stmt);
  }

  @Test
  void availableProducts() throws Exception {
    when(suppliers.availableProducts(7L, 3L)).thenReturn(
        rows("dbo.product_definitions", Map.of("title", "Paper bag")));

    mvc.perform(get("/api/suppliers/7/available-products").param("categoryId", "3"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data.results[0].title").value("Paper bag"));

    verify(suppliers).availableProducts(7L, 3L);
  }

  @Test
  void availableProductsRequiresCategory() throws Exception {
    mvc.perform(get("/api/suppliers/7/available-products"))
        .andExpect(status().isBadRequest());

    verifyNoInteractions(suppliers);
  }

  @Test
  void supplierAndCategorySearch() throws Exception {
    when(suppliers.searchSuppliers(any())).thenReturn(rows("dbo.wholesalers", Map.of("name", "Acme")));
    when(suppliers.searchCategories(any())).thenReturn(rows("dbo.product_categories", Map.of("name", "Bags")));

    mvc.perform(post("/api/suppliers/search").contentType(MediaType.APPLICATION_JSON)
            .content("{ \"select\": [\"name\"], \"where\": { \"key\": \"country\", \"whereCondOp\": \"=\", \"val\": \"DE\" } }"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data.meta.table_fixed").value("dbo.wholesalers"));

    mvc.perform(post("/api/categories/search").contentType(MediaType.APPLICATION_JSON)
            .content("{ \"select\": [\"name\"] }"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data.results[0].name").value("Bags"));
  }
}
