package io.intellixity.catalogq.query.builder;

import io.intellixity.catalogq.query.*;
import io.intellixity.catalogq.schema.JoinTemplate;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class JoinTemplatesTest {
  @Test
  void definesTemplateWithJoins() {
    JoinTemplate t = JoinTemplates.define("category_offerings")
        .from("dbo.product_categories", "pc")
        .innerJoin("dbo.wholesaler_item_offerings", "wio").onColumn("pc.category_id", "wio.category_id")
        .innerJoin("dbo.product_definitions", "pd").onColumn("wio.product_def_id", "pd.product_def_id")
        .buildTemplate();

    assertEquals("category_offerings", t.name());
    assertEquals(TableRef.of("dbo.product_categories", "pc"), t.from());
    assertEquals(2, t.joins().size());
    assertEquals("pd", t.joins().get(1).alias());
  }

  @Test
  void templateBuilderRejectsQueryClauses() {
    JoinStep s = JoinTemplates.define("offering_links").from("dbo.wholesaler_item_offerings", "wio");
    QueryValidationException ex = assertThrows(QueryValidationException.class, s::where);
    assertEquals(QueryValidationException.Reason.BUILDER_MISUSE, ex.reason());
    assertThrows(QueryValidationException.class, s::build);
  }

  @Test
  void blankNameIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> JoinTemplates.define(" "));
  }
}
