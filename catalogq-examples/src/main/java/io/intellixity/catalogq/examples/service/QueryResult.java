package io.intellixity.catalogq.examples.service;

import io.intellixity.catalogq.jdbc.compile.SqlStatement;

import java.util.List;
import java.util.Map;

public record QueryResult(List<Map<String, Object>> rows, SqlStatement statement) {
  public QueryResult {
    rows = List.copyOf(rows);
  }
}
