package io.intellixity.catalogq.jdbc;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class NamedParameterSqlTest {
  @Test
  void rewritesPlaceholdersInOrder() {
    NamedParameterSql.Compiled c = NamedParameterSql.compile(
        "SELECT w.name FROM dbo.wholesalers w WHERE (w.status = @p0 AND w.country IN (@p1, @p10))",
        Map.of("p0", "active", "p1", "DE", "p10", "AT"));

    assertEquals("SELECT w.name FROM dbo.wholesalers w WHERE (w.status = ? AND w.country IN (?, ?))", c.sql());
    assertEquals(List.of("p0", "p1", "p10"), c.names());
    assertEquals(List.of("active", "DE", "AT"), c.values());
  }

  @Test
  void skipsQuotedTextAndSystemVariables() {
    String sql = "SELECT 'it''s @p0' AS note, @@ROWCOUNT AS n WHERE x = @p0";
    assertEquals("SELECT 'it''s @p0' AS note, @@ROWCOUNT AS n WHERE x = ?", NamedParameterSql.toJdbcSql(sql));
    assertEquals(List.of("p0"), NamedParameterSql.parameterNames(sql));
  }

  @Test
  void repeatedNameIsBoundEachTime() {
    NamedParameterSql.Compiled c = NamedParameterSql.compile("a = @id OR b = @id", Map.of("id", 5));
    assertEquals(List.of(5, 5), c.values());
  }

  @Test
  void nullValuesAreKeptAndMissingOnesFail() {
    Map<String, Object> params = new HashMap<>();
    params.put("p0", null);
    assertNull(NamedParameterSql.compile("x = @p0", params).values().get(0));

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> NamedParameterSql.compile("x = @p1", params));
    assertEquals("Missing query param: p1", ex.getMessage());
  }
}
