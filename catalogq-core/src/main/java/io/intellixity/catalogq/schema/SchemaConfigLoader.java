package io.intellixity.catalogq.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.catalogq.query.JoinClause;
import io.intellixity.catalogq.query.QueryDescriptionJsonDeserializer;
import io.intellixity.catalogq.query.TableRef;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

/**
 * Loads tables and join templates from JSON:
 *
 * <pre>
 * {
 *   "tables": [ { "alias": "w", "schema": "dbo", "table": "wholesalers", "columns": ["wholesaler_id", "name"] } ],
 *   "templates": {
 *     "supplier_categories": {
 *       "from": "dbo.wholesalers w",
 *       "joins": [ { "type": "INNER JOIN", "table": "dbo.wholesaler_categories", "alias": "wc",
 *                    "on": { "joinCondOp": "AND", "conditions": [ { "columnA": "w.wholesaler_id", "op": "=", "columnB": "wc.wholesaler_id" } ] } } ]
 *     }
 *   }
 * }
 * </pre>
 */
public final class SchemaConfigLoader {
  private final ObjectMapper json;

  public SchemaConfigLoader() {
    this(new ObjectMapper());
  }

  public SchemaConfigLoader(ObjectMapper json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  public SchemaConfig loadResource(String resource) throws IOException {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = SchemaConfigLoader.class.getClassLoader();
    String path = resource.startsWith("/") ? resource.substring(1) : resource;
    try (InputStream in = cl.getResourceAsStream(path)) {
      if (in == null) throw new IOException("Schema resource not found on classpath: " + resource);
      return load(in);
    }
  }

  public SchemaConfig load(InputStream in) throws IOException {
    JsonNode root = json.readTree(in);
    if (root == null || !root.isObject()) throw new IOException("Schema document must be a JSON object");

    List<TableDefinition> tables = new ArrayList<>();
    JsonNode ts = root.get("tables");
    if (ts == null || !ts.isArray()) throw new IOException("Schema document requires a 'tables' array");
    for (JsonNode t : ts) tables.add(parseTable(t));
    InMemorySchemaRegistry schema = new InMemorySchemaRegistry(tables);

    JoinTemplateRegistry templates = new JoinTemplateRegistry();
    JsonNode tpl = root.get("templates");
    if (tpl != null && tpl.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> it = tpl.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> e = it.next();
        templates.register(parseTemplate(e.getKey(), e.getValue()));
      }
    }
    return new SchemaConfig(schema, templates);
  }

  private static TableDefinition parseTable(JsonNode t) throws IOException {
    String alias = text(t, "alias");
    String table = text(t, "table");
    if (alias == null || table == null) throw new IOException("Table entry requires 'alias' and 'table': " + t);
    Set<String> cols = new LinkedHashSet<>();
    JsonNode cs = t.get("columns");
    if (cs != null && cs.isArray()) for (JsonNode c : cs) cols.add(c.asText());
    return new TableDefinition(alias, text(t, "schema"), table, cols);
  }

  private JoinTemplate parseTemplate(String name, JsonNode n) throws IOException {
    if (!n.isObject()) throw new IOException("Template '" + name + "' must be an object");
    TableRef from = QueryDescriptionJsonDeserializer.parseTableRef(n.get("from"));
    if (from == null) throw new IOException("Template '" + name + "' requires 'from'");
    List<JoinClause> joins = new ArrayList<>();
    JsonNode js = n.get("joins");
    if (js != null && js.isArray()) {
      for (JsonNode j : js) joins.add(QueryDescriptionJsonDeserializer.parseJoin(j, json));
    }
    return new JoinTemplate(name, from, joins);
  }

  private static String text(JsonNode n, String field) {
    JsonNode v = n.get(field);
    return (v == null || v.isNull()) ? null : v.asText();
  }
}
