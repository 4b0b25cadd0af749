package io.intellixity.catalogq.query.builder;

/**
 * Builds {@link io.intellixity.catalogq.schema.JoinTemplate}s with the same join API as queries:
 *
 * <pre>{@code
 * JoinTemplate t = JoinTemplates.define("category_offerings")
 *     .from("dbo.product_categories", "pc")
 *     .innerJoin("dbo.wholesaler_item_offerings", "wio").onColumn("pc.category_id", "wio.category_id")
 *     .buildTemplate();
 * }</pre>
 *
 * WHERE, ORDER BY, paging and {@code build()} are rejected on a template builder.
 */
public final class JoinTemplates {
  private JoinTemplates() {}

  public static FromStep define(String name) {
    QueryDraft draft = QueryDraft.forTemplate(name);
    return draft::from;
  }

  @FunctionalInterface
  public interface FromStep {
    JoinStep from(String table, String alias);
  }
}
