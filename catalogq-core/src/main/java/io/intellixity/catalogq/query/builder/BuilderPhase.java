package io.intellixity.catalogq.query.builder;

/** Position of a builder in the SELECT → FROM → JOIN* → WHERE? → ORDER* → PAGE? → BUILT sequence. */
enum BuilderPhase {
  START,
  FROM,
  JOIN,
  WHERE,
  ORDER,
  PAGE,
  BUILT
}
