package io.intellixity.catalogq.schema;

import io.intellixity.catalogq.query.QueryValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class InMemorySchemaRegistryTest {
  private static final TableDefinition W = TableDefinition.of("w", "dbo", "wholesalers", "wholesaler_id", "name");
  private static final TableDefinition PC = TableDefinition.of("pc", "dbo", "product_categories", "category_id");

  @Test
  void looksUpByAlias() {
    InMemorySchemaRegistry r = InMemorySchemaRegistry.of(W, PC);
    assertEquals(W, r.lookup("w").orElseThrow());
    assertTrue(r.lookup("x").isEmpty());
    assertTrue(r.lookup(null).isEmpty());
    assertEquals(List.of("w", "pc"), List.copyOf(r.aliases()));
    assertEquals(Set.of("wholesaler_id", "name"), r.columnsOf("w"));
  }

  @Test
  void requireListsKnownAliases() {
    InMemorySchemaRegistry r = InMemorySchemaRegistry.of(W, PC);
    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> r.require("zz"));
    assertEquals(QueryValidationException.Reason.UNKNOWN_ALIAS, ex.reason());
    assertTrue(ex.getMessage().contains("w, pc"));
  }

  @Test
  void duplicateAliasIsRejected() {
    TableDefinition other = TableDefinition.of("w", "dbo", "warehouses", "id");
    assertThrows(IllegalArgumentException.class, () -> InMemorySchemaRegistry.of(W, other));
  }

  @Test
  void tableMatchesQualifiedOrBareName() {
    assertTrue(W.matchesTable("dbo.wholesalers"));
    assertTrue(W.matchesTable("wholesalers"));
    assertFalse(W.matchesTable("sales.wholesalers"));
    assertFalse(W.matchesTable(null));
    assertEquals("attributes", TableDefinition.of("a", null, "attributes").qualifiedName());
  }

  @Test
  void columnsAreReadOnly() {
    assertThrows(UnsupportedOperationException.class, () -> W.columns().add("email"));
  }
}
