package io.intellixity.catalogq.schema;

import io.intellixity.catalogq.query.ConditionNode;
import io.intellixity.catalogq.query.JoinClause;
import io.intellixity.catalogq.query.TableRef;

import java.util.List;

import static io.intellixity.catalogq.query.Conditions.and;
import static io.intellixity.catalogq.query.Conditions.columns;

/** The catalog's queryable tables and the standard join templates, all in schema {@code dbo}. */
public final class CatalogSchemas {
  public static final String DB_SCHEMA = "dbo";

  public static final TableDefinition WHOLESALERS = TableDefinition.of("w", DB_SCHEMA, "wholesalers",
      "wholesaler_id", "name", "country", "region", "b2b_notes", "status", "dropship", "website", "email",
      "price_range", "relevance", "category_id", "created_at");

  public static final TableDefinition PRODUCT_CATEGORIES = TableDefinition.of("pc", DB_SCHEMA, "product_categories",
      "category_id", "product_type_id", "name", "description");

  public static final TableDefinition WHOLESALER_CATEGORIES = TableDefinition.of("wc", DB_SCHEMA, "wholesaler_categories",
      "wholesaler_id", "category_id", "comment", "link", "created_at");

  public static final TableDefinition PRODUCT_DEFINITIONS = TableDefinition.of("pd", DB_SCHEMA, "product_definitions",
      "product_def_id", "category_id", "title", "description", "material_id", "form_id", "construction_type_id",
      "surface_finish_id", "for_liquids", "packaging", "created_at");

  public static final TableDefinition OFFERINGS = TableDefinition.of("wio", DB_SCHEMA, "wholesaler_item_offerings",
      "offering_id", "wholesaler_id", "category_id", "product_def_id", "sub_seller", "wholesaler_article_number",
      "material_id", "form_id", "construction_type_id", "surface_finish_id", "color_variant", "title", "size",
      "dimensions", "packaging", "price", "price_per_piece", "weight_grams", "weight_range", "package_weight",
      "origin", "currency", "comment", "quality", "is_assortment", "created_at");

  public static final TableDefinition OFFERING_ATTRIBUTES = TableDefinition.of("woa", DB_SCHEMA,
      "wholesaler_offering_attributes", "offering_id", "attribute_id", "value");

  public static final TableDefinition OFFERING_LINKS = TableDefinition.of("wol", DB_SCHEMA, "wholesaler_offering_links",
      "link_id", "offering_id", "url", "notes", "created_at");

  public static final TableDefinition ATTRIBUTES = TableDefinition.of("a", DB_SCHEMA, "attributes",
      "attribute_id", "name", "description");

  public static final TableDefinition ORDERS = TableDefinition.of("ord", DB_SCHEMA, "orders",
      "order_id", "wholesaler_id", "order_date", "order_number", "status", "total_amount", "currency", "notes",
      "created_at");

  public static final TableDefinition ORDER_ITEMS = TableDefinition.of("ori", DB_SCHEMA, "order_items",
      "order_item_id", "order_id", "offering_id", "quantity", "unit_price", "line_total", "item_notes", "created_at");

  private CatalogSchemas() {}

  public static InMemorySchemaRegistry defaultRegistry() {
    return new InMemorySchemaRegistry(List.of(
        WHOLESALERS, PRODUCT_CATEGORIES, WHOLESALER_CATEGORIES, PRODUCT_DEFINITIONS, OFFERINGS,
        OFFERING_ATTRIBUTES, OFFERING_LINKS, ATTRIBUTES, ORDERS, ORDER_ITEMS));
  }

  public static JoinTemplateRegistry defaultTemplates() {
    JoinTemplateRegistry r = new JoinTemplateRegistry();

    r.register("supplier_categories", ref(WHOLESALERS), List.of(
        inner(WHOLESALER_CATEGORIES, "w.wholesaler_id", "wc.wholesaler_id"),
        inner(PRODUCT_CATEGORIES, "wc.category_id", "pc.category_id")));

    r.register("category_offerings", ref(PRODUCT_CATEGORIES), List.of(
        inner(OFFERINGS, "pc.category_id", "wio.category_id"),
        inner(PRODUCT_DEFINITIONS, "wio.product_def_id", "pd.product_def_id")));

    r.register("wholesaler_category_offerings", ref(WHOLESALER_CATEGORIES), List.of(
        inner(OFFERINGS, "wc.wholesaler_id", "wio.wholesaler_id")));

    r.register("wholesaler_item_offering_product_def", ref(OFFERINGS), List.of(
        inner(PRODUCT_DEFINITIONS, "wio.product_def_id", "pd.product_def_id")));

    r.register("offering_attributes", ref(OFFERINGS), List.of(
        inner(OFFERING_ATTRIBUTES, "wio.offering_id", "woa.offering_id"),
        inner(ATTRIBUTES, "woa.attribute_id", "a.attribute_id")));

    r.register("offering_links", ref(OFFERINGS), List.of(
        inner(OFFERING_LINKS, "wio.offering_id", "wol.offering_id")));

    return r;
  }

  private static TableRef ref(TableDefinition t) {
    return new TableRef(t.qualifiedName(), t.alias());
  }

  /** INNER JOIN whose ON clause ANDs the given column pairs (left1, right1, left2, right2, ...). */
  private static JoinClause inner(TableDefinition t, String... pairs) {
    if (pairs.length == 0 || pairs.length % 2 != 0) throw new IllegalArgumentException("column pairs expected");
    ConditionNode[] on = new ConditionNode[pairs.length / 2];
    for (int i = 0; i < on.length; i++) on[i] = columns(pairs[2 * i], pairs[2 * i + 1]);
    return JoinClause.inner(t.qualifiedName(), t.alias(), and(on));
  }
}
