package io.intellixity.catalogq.examples.web;

import io.intellixity.catalogq.examples.service.SupplierService;
import io.intellixity.catalogq.query.QueryDescription;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/suppliers")
public final class SupplierController {
  private final SupplierService suppliers;

  public SupplierController(SupplierService suppliers) {
    this.suppliers = suppliers;
  }

  @PostMapping(value = "/search", consumes = MediaType.APPLICATION_JSON_VALUE)
  public QueryResponse search(@RequestBody QueryDescription payload) {
    return QueryResponse.of(suppliers.searchSuppliers(payload));
  }

  @GetMapping("/{id}/available-products")
  public QueryResponse availableProducts(@PathVariable("id") long supplierId,
                                         @RequestParam("categoryId") long categoryId) {
    return QueryResponse.of(suppliers.availableProducts(supplierId, categoryId));
  }
}
