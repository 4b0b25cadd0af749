package io.intellixity.catalogq.schema;

import io.intellixity.catalogq.query.ComparisonOp;
import io.intellixity.catalogq.query.JoinColumnCondition;
import io.intellixity.catalogq.query.JoinKind;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

final class SchemaConfigLoaderTest {
  @Test
  void loadsTablesAndTemplatesFromClasspath() throws Exception {
    SchemaConfig cfg = new SchemaConfigLoader().loadResource("test-schema.json");

    assertEquals(3, cfg.schema().aliases().size());
    TableDefinition w = cfg.schema().require("w");
    assertEquals("dbo.wholesalers", w.qualifiedName());
    assertTrue(w.hasColumn("b2b_notes"));

    JoinTemplate t = cfg.templates().lookup("supplier_categories").orElseThrow();
    assertEquals("w", t.from().alias());
    assertEquals("dbo.wholesalers", t.from().table());
    assertEquals(2, t.joins().size());
    assertEquals(JoinKind.INNER, t.joins().get(0).kind());
    assertEquals(new JoinColumnCondition("w.wholesaler_id", ComparisonOp.EQ, "wc.wholesaler_id"),
        t.joins().get(0).on().children().get(0));
  }

  @Test
  void missingResourceFails() {
    IOException ex = assertThrows(IOException.class, () -> new SchemaConfigLoader().loadResource("/nope.json"));
    assertTrue(ex.getMessage().contains("nope.json"));
  }

  @Test
  void tablesArrayIsRequired() {
    var in = new ByteArrayInputStream("{\"templates\":{}}".getBytes(StandardCharsets.UTF_8));
    assertThrows(IOException.class, () -> new SchemaConfigLoader().load(in));
  }

  @Test
  void templateWithoutFromFails() {
    String s = """
        { "tables": [ { "alias": "w", "table": "wholesalers", "columns": ["name"] } ],
          "templates": { "broken": { "joins": [] } } }
        """;
    var in = new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    IOException ex = assertThrows(IOException.class, () -> new SchemaConfigLoader().load(in));
    assertTrue(ex.getMessage().contains("broken"));
  }
}
