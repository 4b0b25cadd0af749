package io.intellixity.catalogq.examples.web;

import io.intellixity.catalogq.examples.service.SupplierService;
import io.intellixity.catalogq.query.QueryDescription;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/categories")
public final class CategoryController {
  private final SupplierService suppliers;

  public CategoryController(SupplierService suppliers) {
    this.suppliers = suppliers;
  }

  @PostMapping(value = "/search", consumes = MediaType.APPLICATION_JSON_VALUE)
  public QueryResponse search(@RequestBody QueryDescription payload) {
    return QueryResponse.of(suppliers.searchCategories(payload));
  }
}
