package io.intellixity.catalogq.schema;

import io.intellixity.catalogq.query.JoinClause;
import io.intellixity.catalogq.query.TableRef;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class CatalogSchemasTest {
  @Test
  void registersAllCatalogTables() {
    InMemorySchemaRegistry r = CatalogSchemas.defaultRegistry();
    assertEquals(Set.of("w", "pc", "wc", "pd", "wio", "woa", "wol", "a", "ord", "ori"), r.aliases());
    assertEquals("dbo.wholesaler_item_offerings", r.require("wio").qualifiedName());
  }

  @Test
  void templatesOnlyUseRegisteredAliases() {
    InMemorySchemaRegistry r = CatalogSchemas.defaultRegistry();
    JoinTemplateRegistry templates = CatalogSchemas.defaultTemplates();
    assertEquals(Set.of("supplier_categories", "category_offerings", "wholesaler_category_offerings",
        "wholesaler_item_offering_product_def", "offering_attributes", "offering_links"), templates.names());

    for (String name : templates.names()) {
      JoinTemplate t = templates.lookup(name).orElseThrow();
      assertTrue(r.require(t.from().alias()).matchesTable(t.from().table()), name);
      for (JoinClause j : t.joins()) {
        assertTrue(r.require(j.alias()).matchesTable(j.table()), name + " " + j.alias());
        assertFalse(j.on().isEmpty(), name + " " + j.alias());
      }
    }
  }

  @Test
  void templateNamesAreUnique() {
    JoinTemplateRegistry templates = new JoinTemplateRegistry()
        .register("offering_links", TableRef.of("dbo.wholesaler_item_offerings", "wio"), List.of());
    assertThrows(IllegalArgumentException.class,
        () -> templates.register("offering_links", TableRef.of("dbo.wholesaler_item_offerings", "wio"), List.of()));
    assertTrue(templates.lookup(null).isEmpty());
  }
}
