package io.intellixity.catalogq.jdbc.compile;

import io.intellixity.catalogq.query.TableRef;

/**
 * How the FROM clause of a statement is resolved. A named template wins over a fixed FROM, which wins over the
 * FROM carried by the query description.
 */
public record CompileOptions(String namedTemplate, TableRef fixedFrom) {
  private static final CompileOptions NONE = new CompileOptions(null, null);

  public CompileOptions {
    namedTemplate = (namedTemplate == null || namedTemplate.isBlank()) ? null : namedTemplate.trim();
  }

  public static CompileOptions none() { return NONE; }

  public static CompileOptions namedTemplate(String name) { return new CompileOptions(name, null); }

  public static CompileOptions fixedFrom(TableRef from) { return new CompileOptions(null, from); }
}
