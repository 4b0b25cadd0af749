package io.intellixity.catalogq.schema;

import java.util.Objects;

/** Registries loaded together from one configuration document. */
public record SchemaConfig(InMemorySchemaRegistry schema, JoinTemplateRegistry templates) {
  public SchemaConfig {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(templates, "templates");
  }
}
