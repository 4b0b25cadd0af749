package io.intellixity.catalogq.query;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ConditionTest {
  @Test
  void inCopiesCollectionsAndArrays() {
    List<Object> src = new ArrayList<>(List.of(1, 2));
    Condition c = Conditions.in("w.wholesaler_id", src);
    src.add(3);
    assertEquals(List.of(1, 2), c.values());
    assertThrows(UnsupportedOperationException.class, () -> c.values().add(4));

    Condition fromArray = new Condition("w.wholesaler_id", ComparisonOp.NOT_IN, new long[]{7L, 8L});
    assertEquals(List.of(7L, 8L), fromArray.values());
  }

  @Test
  void inRequiresAList() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> new Condition("w.status", ComparisonOp.IN, "active"));
    assertTrue(ex.getMessage().contains("requires a list"));
  }

  @Test
  void scalarOperatorRejectsCollections() {
    assertThrows(IllegalArgumentException.class, () -> new Condition("w.status", ComparisonOp.EQ, List.of("a")));
  }

  @Test
  void nullChecksCarryNoValue() {
    assertNull(Conditions.isNull("wio.offering_id").value());
    assertThrows(IllegalArgumentException.class, () -> new Condition("wio.offering_id", ComparisonOp.IS_NULL, 1));
  }

  @Test
  void scalarNullIsKept() {
    Condition c = Conditions.eq("w.region", null);
    assertNull(c.value());
    assertEquals("w.region = null", c.toString());
  }

  @Test
  void blankTargetIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> Conditions.eq("  ", 1));
  }

  @Test
  void operatorParsesSqlTokensAndNames() {
    assertEquals(ComparisonOp.NE, ComparisonOp.fromSql("<>"));
    assertEquals(ComparisonOp.NE, ComparisonOp.fromSql("!="));
    assertEquals(ComparisonOp.NOT_IN, ComparisonOp.fromSql("not   in"));
    assertEquals(ComparisonOp.IS_NOT_NULL, ComparisonOp.fromSql("is_not_null"));
    assertThrows(IllegalArgumentException.class, () -> ComparisonOp.fromSql("BETWEEN"));
  }

  @Test
  void columnConditionRejectsValueOnlyOperators() {
    assertThrows(IllegalArgumentException.class,
        () -> new JoinColumnCondition("w.wholesaler_id", ComparisonOp.IN, "wc.wholesaler_id"));
    assertThrows(IllegalArgumentException.class,
        () -> new JoinColumnCondition("w.wholesaler_id", ComparisonOp.IS_NULL, "wc.wholesaler_id"));
  }
}
