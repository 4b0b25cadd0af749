package io.intellixity.catalogq.examples.service;

import io.intellixity.catalogq.jdbc.compile.CompileOptions;
import io.intellixity.catalogq.query.ComparisonOp;
import io.intellixity.catalogq.query.QueryDescription;
import io.intellixity.catalogq.query.TableRef;
import io.intellixity.catalogq.query.builder.Queries;
import org.springframework.stereotype.Service;

@Service
public final class SupplierService {
  static final TableRef WHOLESALERS = TableRef.of("dbo.wholesalers", "w");
  static final TableRef CATEGORIES = TableRef.of("dbo.product_categories", "pc");

  private final QueryService queries;

  public SupplierService(QueryService queries) {
    this.queries = queries;
  }

  public QueryResult searchSuppliers(QueryDescription payload) {
    return queries.withFixedFrom(WHOLESALERS, payload);
  }

  public QueryResult searchCategories(QueryDescription payload) {
    return queries.withFixedFrom(CATEGORIES, payload);
  }

  /**
   * Product definitions of a category that the supplier does not offer yet: LEFT JOIN offerings restricted to the
   * supplier in ON, then keep only rows without a match.
   */
  public QueryResult availableProducts(long supplierId, long categoryId) {
    return queries.run(availableProductsQuery(supplierId, categoryId), CompileOptions.none());
  }

  static QueryDescription availableProductsQuery(long supplierId, long categoryId) {
    return Queries.select("pd.product_def_id", "pd.title", "pd.description", "pd.category_id")
        .from("dbo.product_definitions", "pd")
        .leftJoin("dbo.wholesaler_item_offerings", "wio")
        .onColumn("pd.product_def_id", "wio.product_def_id")
        .onValue("wio.wholesaler_id", ComparisonOp.EQ, supplierId)
        .where()
        .and("wio.offering_id", ComparisonOp.IS_NULL)
        .and("pd.category_id", ComparisonOp.EQ, categoryId)
        .orderBy("pd.title")
        .build();
  }
}
