package io.intellixity.catalogq.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.*;

import java.io.IOException;
import java.util.*;

/**
 * Reads the client wire format of a {@link QueryDescription}.
 *
 * <pre>
 * {
 *   "select": ["w.name", "pc.name AS category_name"],
 *   "from": { "table": "dbo.wholesalers", "alias": "w" },
 *   "joins": [ { "type": "INNER JOIN", "table": "dbo.product_categories", "alias": "pc",
 *                "on": { "joinCondOp": "AND", "conditions": [ { "columnA": "w.category_id", "op": "=", "columnB": "pc.category_id" } ] } } ],
 *   "where": { "whereCondOp": "AND", "conditions": [ { "key": "w.status", "whereCondOp": "=", "val": "active" } ] },
 *   "orderBy": [ { "key": "w.name", "direction": "asc" } ],
 *   "limit": 20, "offset": 0
 * }
 * </pre>
 *
 * Condition node kinds are told apart here, at the JSON boundary, and turned into the sealed
 * {@link ConditionNode} variants. Shapes that match no variant raise
 * {@link QueryValidationException.Reason#UNSUPPORTED_CONDITION_NODE}.
 */
public final class QueryDescriptionJsonDeserializer extends JsonDeserializer<QueryDescription> {
  private static final ObjectMapper DEFAULT_CODEC = new ObjectMapper();

  @Override
  public QueryDescription deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    return fromTree(root, codec);
  }

  /** Convert an already parsed payload. */
  public static QueryDescription fromTree(JsonNode root) {
    try {
      return fromTree(root, DEFAULT_CODEC);
    } catch (IOException e) {
      throw new IllegalArgumentException("Malformed query payload", e);
    }
  }

  static QueryDescription fromTree(JsonNode root, ObjectCodec codec) throws IOException {
    if (root == null || !root.isObject()) throw new IllegalArgumentException("Query payload must be a JSON object");

    List<String> select = new ArrayList<>();
    JsonNode sel = root.get("select");
    if (sel != null && !sel.isNull()) {
      if (!sel.isArray()) throw new IllegalArgumentException("select must be an array of strings");
      for (JsonNode x : sel) {
        if (!x.isTextual()) throw new IllegalArgumentException("select entries must be strings: " + x);
        select.add(x.asText());
      }
    }

    TableRef from = parseTableRef(root.get("from"));

    List<JoinClause> joins = new ArrayList<>();
    JsonNode js = root.get("joins");
    if (js != null && js.isArray()) {
      for (JsonNode j : js) joins.add(parseJoin(j, codec));
    }

    ConditionGroup where = null;
    JsonNode w = root.get("where");
    if (w != null && !w.isNull()) {
      ConditionNode n = parseNode(w, codec);
      where = (n instanceof ConditionGroup g) ? g : new ConditionGroup(Combinator.AND, List.of(n));
    }

    List<SortKey> orderBy = new ArrayList<>();
    JsonNode ob = root.get("orderBy");
    if (ob != null && ob.isArray()) {
      for (JsonNode s : ob) {
        if (!s.isObject()) continue;
        String key = textOrNull(s.get("key"));
        if (key == null) continue;
        orderBy.add(new SortKey(key, SortKey.Direction.parse(textOrNull(s.get("direction")))));
      }
    }

    return new QueryDescription(select, from, joins, where, orderBy,
        intOrNull(root.get("limit"), "limit"), intOrNull(root.get("offset"), "offset"));
  }

  /** Parse a single JOIN object, shared with the template loader. */
  public static JoinClause parseJoin(JsonNode j, ObjectCodec codec) throws IOException {
    if (j == null || !j.isObject()) throw new IllegalArgumentException("join must be an object");
    String table = textOrNull(j.get("table"));
    if (table == null) throw new IllegalArgumentException("join requires table");
    JoinKind kind = JoinKind.fromSql(textOrNull(j.get("type")));
    String alias = textOrNull(j.get("alias"));

    JsonNode on = j.get("on");
    ConditionGroup group;
    if (on == null || on.isNull()) {
      group = new ConditionGroup(Combinator.AND, List.of());
    } else {
      ConditionNode n = parseNode(on, codec);
      group = (n instanceof ConditionGroup g) ? g : new ConditionGroup(Combinator.AND, List.of(n));
    }
    return new JoinClause(kind, table, alias, group);
  }

  /** Accepts {@code {"table":..,"alias":..}} or the compact {@code "dbo.wholesalers w"}. */
  public static TableRef parseTableRef(JsonNode n) {
    if (n == null || n.isNull()) return null;
    if (n.isTextual()) {
      String[] parts = n.asText().trim().split("\\s+");
      if (parts.length == 1) return new TableRef(parts[0], null);
      if (parts.length == 2) return new TableRef(parts[0], parts[1]);
      throw new IllegalArgumentException("from must be 'table' or 'table alias': " + n.asText());
    }
    if (n.isObject()) return new TableRef(textOrNull(n.get("table")), textOrNull(n.get("alias")));
    throw new IllegalArgumentException("Unsupported from clause: " + n);
  }

  private static ConditionNode parseNode(JsonNode n, ObjectCodec codec) throws IOException {
    if (n == null || !n.isObject()) throw unsupported(n);

    if (n.has("conditions")) {
      String op = firstText(n, "whereCondOp", "joinCondOp", "op");
      return new ConditionGroup(parseCombinator(op, n), parseChildren(n.get("conditions"), codec));
    }
    if (n.has("and") && n.size() == 1) return new ConditionGroup(Combinator.AND, parseChildren(n.get("and"), codec));
    if (n.has("or") && n.size() == 1) return new ConditionGroup(Combinator.OR, parseChildren(n.get("or"), codec));

    if (n.has("columnA") && n.has("columnB")) {
      return new JoinColumnCondition(textOrNull(n.get("columnA")), parseOp(firstText(n, "op", "whereCondOp"), n),
          textOrNull(n.get("columnB")));
    }
    if (n.has("key")) {
      ComparisonOp op = parseOp(firstText(n, "whereCondOp", "op"), n);
      Object value = op.takesValue() ? decodeValue(n.get("val"), codec) : null;
      return new Condition(textOrNull(n.get("key")), op, value);
    }
    throw unsupported(n);
  }

  private static List<ConditionNode> parseChildren(JsonNode arr, ObjectCodec codec) throws IOException {
    if (arr == null || arr.isNull()) return List.of();
    if (!arr.isArray()) throw unsupported(arr);
    List<ConditionNode> out = new ArrayList<>();
    for (JsonNode x : arr) out.add(parseNode(x, codec));
    return out;
  }

  private static Combinator parseCombinator(String op, JsonNode n) {
    try {
      return Combinator.parse(op);
    } catch (IllegalArgumentException e) {
      throw new QueryValidationException(QueryValidationException.Reason.UNSUPPORTED_CONDITION_NODE,
          "Unsupported group combinator '" + op + "' in " + n, e);
    }
  }

  private static ComparisonOp parseOp(String op, JsonNode n) {
    if (op == null) {
      throw new QueryValidationException(QueryValidationException.Reason.UNSUPPORTED_CONDITION_NODE,
          "Condition without operator: " + n);
    }
    try {
      return ComparisonOp.fromSql(op);
    } catch (IllegalArgumentException e) {
      throw new QueryValidationException(QueryValidationException.Reason.UNSUPPORTED_CONDITION_NODE,
          "Unsupported comparison operator '" + op + "' in " + n, e);
    }
  }

  private static Object decodeValue(JsonNode v, ObjectCodec codec) throws IOException {
    if (v == null || v.isNull()) return null;
    return codec.treeToValue(v, Object.class);
  }

  private static QueryValidationException unsupported(JsonNode n) {
    return new QueryValidationException(QueryValidationException.Reason.UNSUPPORTED_CONDITION_NODE,
        "Unsupported condition node: " + n);
  }

  private static String firstText(JsonNode n, String... keys) {
    for (String k : keys) {
      String s = textOrNull(n.get(k));
      if (s != null) return s;
    }
    return null;
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }

  private static Integer intOrNull(JsonNode n, String field) {
    if (n == null || n.isNull()) return null;
    int v;
    if (n.isNumber()) {
      if (!n.isIntegralNumber() || !n.canConvertToInt()) throw notAnUnsignedInt(field, n);
      v = n.intValue();
    } else {
      try {
        v = Integer.parseInt(n.asText().trim());
      } catch (NumberFormatException e) {
        throw notAnUnsignedInt(field, n);
      }
    }
    if (v < 0) throw notAnUnsignedInt(field, n);
    return v;
  }

  private static IllegalArgumentException notAnUnsignedInt(String field, JsonNode n) {
    return new IllegalArgumentException(field + " must be an integer between 0 and " + Integer.MAX_VALUE + ": " + n);
  }
}
