package io.intellixity.catalogq.query.builder;

import io.intellixity.catalogq.query.JoinKind;
import io.intellixity.catalogq.schema.JoinTemplate;

public interface JoinStep extends FilterStep {
  JoinBuilder join(JoinKind kind, String table, String alias);

  default JoinBuilder innerJoin(String table, String alias) { return join(JoinKind.INNER, table, alias); }

  default JoinBuilder leftJoin(String table, String alias) { return join(JoinKind.LEFT, table, alias); }

  /** Only valid on builders started with {@link JoinTemplates#define(String)}. */
  JoinTemplate buildTemplate();
}
