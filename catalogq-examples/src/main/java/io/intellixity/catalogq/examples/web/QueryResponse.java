package io.intellixity.catalogq.examples.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.intellixity.catalogq.examples.service.QueryResult;
import io.intellixity.catalogq.jdbc.compile.QueryMetadata;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record QueryResponse(boolean success, String message, Data data, ApiErrorResponse.ResponseMeta meta) {
  public record Data(List<Map<String, Object>> results, Meta meta) {}

  public record Meta(@JsonProperty("retrieved_at") String retrievedAt,
                     @JsonProperty("result_count") int resultCount,
                     @JsonProperty("columns_selected") List<String> columnsSelected,
                     @JsonProperty("has_joins") boolean hasJoins,
                     @JsonProperty("has_where") boolean hasWhere,
                     @JsonProperty("parameter_count") int parameterCount,
                     @JsonProperty("table_fixed") String tableFixed,
                     @JsonProperty("sql_generated") String sqlGenerated) {}

  static QueryResponse of(QueryResult r) {
    String now = Instant.now().toString();
    QueryMetadata m = r.statement().metadata();
    Meta meta = new Meta(now, r.rows().size(), m.selectColumns(), m.hasJoins(), m.hasWhere(), m.parameterCount(),
        m.resolvedFrom(), r.statement().sql());
    return new QueryResponse(true, "Query executed successfully.", new Data(r.rows(), meta),
        new ApiErrorResponse.ResponseMeta(now));
  }
}
