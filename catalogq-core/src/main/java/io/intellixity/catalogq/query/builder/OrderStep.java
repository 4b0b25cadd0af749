package io.intellixity.catalogq.query.builder;

import io.intellixity.catalogq.query.SortKey;

public interface OrderStep extends PageStep {
  OrderStep orderBy(String target, SortKey.Direction direction);

  default OrderStep orderBy(String target) { return orderBy(target, SortKey.Direction.ASC); }
}
