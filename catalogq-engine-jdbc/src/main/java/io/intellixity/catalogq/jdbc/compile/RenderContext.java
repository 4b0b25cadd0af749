package io.intellixity.catalogq.jdbc.compile;

import java.util.*;

/** Parameter counter and values for one compile call. Names are {@code p0, p1, ...}; placeholders {@code @pN}. */
final class RenderContext {
  private int next = 0;
  private final Map<String, Object> parameters = new LinkedHashMap<>();

  String bind(Object value) {
    String name = "p" + (next++);
    parameters.put(name, value);
    return "@" + name;
  }

  int parameterCount() { return next; }

  Map<String, Object> parameters() { return parameters; }
}
