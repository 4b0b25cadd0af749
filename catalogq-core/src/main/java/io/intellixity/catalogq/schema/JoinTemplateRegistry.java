package io.intellixity.catalogq.schema;

import io.intellixity.catalogq.query.JoinClause;
import io.intellixity.catalogq.query.TableRef;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named join templates. Templates are registered during startup; lookups are safe from any thread.
 */
public final class JoinTemplateRegistry {
  private final Map<String, JoinTemplate> templates = new ConcurrentHashMap<>();

  public JoinTemplateRegistry register(JoinTemplate template) {
    Objects.requireNonNull(template, "template");
    JoinTemplate prev = templates.putIfAbsent(template.name(), template);
    if (prev != null) throw new IllegalArgumentException("Join template already registered: " + template.name());
    return this;
  }

  public JoinTemplateRegistry register(String name, TableRef from, List<JoinClause> joins) {
    return register(new JoinTemplate(name, from, joins));
  }

  public Optional<JoinTemplate> lookup(String name) {
    if (name == null) return Optional.empty();
    return Optional.ofNullable(templates.get(name));
  }

  public Set<String> names() { return new TreeSet<>(templates.keySet()); }
}
