package io.intellixity.catalogq.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

final class QueryDescriptionJsonTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Test
  void parsesClientPayload() throws Exception {
    String s = """
        {
          "select": ["w.name", "pc.name AS category_name"],
          "from": { "table": "dbo.wholesalers", "alias": "w" },
          "joins": [
            { "type": "LEFT JOIN", "table": "dbo.product_categories", "alias": "pc",
              "on": { "joinCondOp": "AND", "conditions": [
                { "columnA": "w.category_id", "op": "=", "columnB": "pc.category_id" } ] } }
          ],
          "where": { "whereCondOp": "OR", "conditions": [
            { "key": "w.status", "whereCondOp": "=", "val": "active" },
            { "key": "w.country", "whereCondOp": "IN", "val": ["DE", "AT"] },
            { "key": "w.region", "whereCondOp": "IS NULL" }
          ] },
          "orderBy": [ { "key": "w.name", "direction": "desc" } ],
          "limit": 20,
          "offset": 40
        }
        """;
    QueryDescription q = JSON.readValue(s, QueryDescription.class);

    assertEquals(List.of("w.name", "pc.name AS category_name"), q.select());
    assertEquals(TableRef.of("dbo.wholesalers", "w"), q.from());
    assertEquals(1, q.joins().size());
    JoinClause j = q.joins().get(0);
    assertEquals(JoinKind.LEFT, j.kind());
    assertEquals("pc", j.alias());
    assertEquals(new JoinColumnCondition("w.category_id", ComparisonOp.EQ, "pc.category_id"), j.on().children().get(0));

    assertEquals(Combinator.OR, q.where().combinator());
    assertEquals(3, q.where().children().size());
    Condition in = (Condition) q.where().children().get(1);
    assertEquals(ComparisonOp.IN, in.operator());
    assertEquals(List.of("DE", "AT"), in.values());
    assertEquals(ComparisonOp.IS_NULL, ((Condition) q.where().children().get(2)).operator());

    assertEquals(List.of(SortKey.desc("w.name")), q.orderBy());
    assertEquals(20, q.limit());
    assertEquals(40, q.offset());
  }

  @Test
  void compactFromAndBareConditionAsWhere() throws Exception {
    String s = """
        { "select": ["name"], "from": "dbo.wholesalers w",
          "where": { "key": "status", "whereCondOp": "<>", "val": "blocked" } }
        """;
    QueryDescription q = JSON.readValue(s, QueryDescription.class);
    assertEquals("w", q.from().alias());
    assertEquals(Combinator.AND, q.where().combinator());
    assertEquals(Conditions.ne("status", "blocked"), q.where().children().get(0));
  }

  @Test
  void unknownNodeShapeIsRejected() throws Exception {
    var tree = JSON.readTree("""
        { "select": ["w.name"], "where": { "conditions": [ { "field": "w.name", "value": "x" } ] } }
        """);
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> QueryDescriptionJsonDeserializer.fromTree(tree));
    assertEquals(QueryValidationException.Reason.UNSUPPORTED_CONDITION_NODE, ex.reason());
  }

  @Test
  void unknownOperatorIsRejected() throws Exception {
    var tree = JSON.readTree("""
        { "select": ["w.name"], "where": { "key": "w.name", "whereCondOp": "SOUNDS LIKE", "val": "x" } }
        """);
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> QueryDescriptionJsonDeserializer.fromTree(tree));
    assertTrue(ex.getMessage().contains("SOUNDS LIKE"));
  }

  @Test
  void writesWhatItReads() throws Exception {
    QueryDescription q = new QueryDescription(
        List.of("w.name"),
        TableRef.of("dbo.wholesalers", "w"),
        List.of(JoinClause.inner("dbo.wholesaler_categories", "wc",
            Conditions.and(Conditions.columns("w.wholesaler_id", "wc.wholesaler_id")))),
        Conditions.or(Conditions.eq("w.status", "active"), Conditions.and(Conditions.isNotNull("w.email"))),
        List.of(SortKey.asc("w.name")),
        10, null);

    String json = JSON.writeValueAsString(q);
    assertTrue(json.contains("\"columnA\":\"w.wholesaler_id\""));
    assertFalse(json.contains("offset"));
    assertEquals(q, JSON.readValue(json, QueryDescription.class));
  }

  @Test
  void limitAndOffsetMustBeUnsignedInts() throws Exception {
    for (String paging : List.of("\"limit\": 4294967316", "\"offset\": 2.9", "\"limit\": -1", "\"offset\": \"3.5\"")) {
      var tree = JSON.readTree("{ \"select\": [\"w.name\"], \"from\": \"dbo.wholesalers w\", " + paging + " }");
      IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
          () -> QueryDescriptionJsonDeserializer.fromTree(tree), paging);
      assertTrue(ex.getMessage().contains(paging.substring(1, paging.indexOf('"', 1))), ex.getMessage());
    }

    var max = JSON.readTree("""
        { "select": ["w.name"], "from": "dbo.wholesalers w", "limit": 2147483647, "offset": "0" }
        """);
    QueryDescription q = QueryDescriptionJsonDeserializer.fromTree(max);
    assertEquals(Integer.MAX_VALUE, q.limit());
    assertEquals(0, q.offset());
  }

  @Test
  void nonStringSelectEntriesAreRejected() throws Exception {
    var tree = JSON.readTree("""
        { "select": ["w.name", 5, {}], "from": "dbo.wholesalers w" }
        """);
    assertThrows(IllegalArgumentException.class, () -> QueryDescriptionJsonDeserializer.fromTree(tree));

    var notArray = JSON.readTree("""
        { "select": "w.name", "from": "dbo.wholesalers w" }
        """);
    assertThrows(IllegalArgumentException.class, () -> QueryDescriptionJsonDeserializer.fromTree(notArray));
  }

  @Test
  void sortDirectionIsWrittenLowerCaseInAnyLocale() throws Exception {
    Locale saved = Locale.getDefault();
    Locale.setDefault(Locale.forLanguageTag("tr-TR"));
    try {
      QueryDescription q = new QueryDescription(List.of("w.name"), TableRef.of("dbo.wholesalers", "w"),
          List.of(), null, List.of(SortKey.asc("w.name"), SortKey.desc("w.relevance")), null, null);
      String json = JSON.writeValueAsString(q);
      assertTrue(json.contains("\"direction\":\"asc\""), json);
      assertTrue(json.contains("\"direction\":\"desc\""), json);
    } finally {
      Locale.setDefault(saved);
    }
  }
}
