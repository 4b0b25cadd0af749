package io.intellixity.catalogq.jdbc.compile;

import java.util.List;

/**
 * Facts about a compiled statement reported back to API clients.
 *
 * @param resolvedFrom the template name when compiled against a join template, otherwise the FROM table
 */
public record QueryMetadata(List<String> selectColumns,
                            boolean hasJoins,
                            boolean hasWhere,
                            int parameterCount,
                            String resolvedFrom) {
  public QueryMetadata {
    selectColumns = List.copyOf(selectColumns);
  }
}
