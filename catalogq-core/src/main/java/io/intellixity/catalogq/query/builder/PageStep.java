package io.intellixity.catalogq.query.builder;

import io.intellixity.catalogq.query.QueryDescription;

public interface PageStep {
  PageStep limit(int limit);

  PageStep offset(int offset);

  /** Freeze the query. Every continuation obtained from this builder is unusable afterwards. */
  QueryDescription build();
}
