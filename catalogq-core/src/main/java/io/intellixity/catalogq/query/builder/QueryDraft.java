package io.intellixity.catalogq.query.builder;

import io.intellixity.catalogq.query.*;
import io.intellixity.catalogq.schema.JoinTemplate;

import java.util.*;
import java.util.function.Consumer;

import static io.intellixity.catalogq.query.QueryValidationException.Reason.*;

/**
 * State shared by every continuation of one builder chain. Continuations check the phase before mutating, so a
 * stale reference (an earlier join, a WHERE builder after ORDER BY, anything after build) fails instead of
 * silently editing a query that was already moved past.
 */
final class QueryDraft implements SelectStep, JoinStep {
  private final String templateName;
  private final List<String> select;
  private TableRef from;
  private boolean overTemplate;
  private final List<JoinDraft> joins = new ArrayList<>();
  private JoinDraft activeJoin;
  private WhereDraft where;
  private final List<SortKey> orderBy = new ArrayList<>();
  private Integer limit;
  private Integer offset;
  private BuilderPhase phase = BuilderPhase.START;

  QueryDraft(List<String> select) {
    this(null, select);
  }

  private QueryDraft(String templateName, List<String> select) {
    this.templateName = templateName;
    this.select = select;
  }

  static QueryDraft forTemplate(String name) {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("template name must not be blank");
    return new QueryDraft(name, List.of());
  }

  // ---- SelectStep ----

  @Override
  public JoinStep from(String table, String alias) {
    if (table == null || table.isBlank() || alias == null || alias.isBlank()) {
      throw new QueryValidationException(MISSING_REQUIRED_CLAUSE, "FROM requires a table and an alias");
    }
    advance(BuilderPhase.FROM, "from()", BuilderPhase.START);
    this.from = new TableRef(table, alias);
    return this;
  }

  @Override
  public FilterStep overTemplate() {
    requireQueryMode("overTemplate()");
    advance(BuilderPhase.FROM, "overTemplate()", BuilderPhase.START);
    this.overTemplate = true;
    return this;
  }

  // ---- JoinStep ----

  @Override
  public JoinBuilder join(JoinKind kind, String table, String alias) {
    if (overTemplate) throw misuse("join() on a query compiled against a join template");
    if (alias == null || alias.isBlank()) {
      throw new QueryValidationException(ANONYMOUS_JOIN, "Join of table '" + table + "' has no alias");
    }
    advance(BuilderPhase.JOIN, "join()", BuilderPhase.FROM, BuilderPhase.JOIN);
    JoinDraft j = new JoinDraft(kind, table, alias);
    joins.add(j);
    activeJoin = j;
    return j;
  }

  @Override
  public JoinTemplate buildTemplate() {
    if (templateName == null) throw misuse("buildTemplate() on a query builder");
    advance(BuilderPhase.BUILT, "buildTemplate()", BuilderPhase.FROM, BuilderPhase.JOIN);
    activeJoin = null;
    return new JoinTemplate(templateName, from, joinClauses());
  }

  // ---- FilterStep / OrderStep / PageStep ----

  @Override
  public WhereBuilder where() {
    requireQueryMode("where()");
    advance(BuilderPhase.WHERE, "where()", BuilderPhase.FROM, BuilderPhase.JOIN);
    activeJoin = null;
    where = new WhereDraft();
    return where;
  }

  @Override
  public OrderStep orderBy(String target, SortKey.Direction direction) {
    requireQueryMode("orderBy()");
    advance(BuilderPhase.ORDER, "orderBy()",
        BuilderPhase.FROM, BuilderPhase.JOIN, BuilderPhase.WHERE, BuilderPhase.ORDER);
    activeJoin = null;
    orderBy.add(new SortKey(target, direction));
    return this;
  }

  @Override
  public PageStep limit(int limit) {
    requireQueryMode("limit()");
    if (this.limit != null) throw misuse("limit() called twice");
    if (limit < 0) throw new IllegalArgumentException("limit must be >= 0");
    advance(BuilderPhase.PAGE, "limit()",
        BuilderPhase.FROM, BuilderPhase.JOIN, BuilderPhase.WHERE, BuilderPhase.ORDER, BuilderPhase.PAGE);
    activeJoin = null;
    this.limit = limit;
    return this;
  }

  @Override
  public PageStep offset(int offset) {
    requireQueryMode("offset()");
    if (this.offset != null) throw misuse("offset() called twice");
    if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
    advance(BuilderPhase.PAGE, "offset()",
        BuilderPhase.FROM, BuilderPhase.JOIN, BuilderPhase.WHERE, BuilderPhase.ORDER, BuilderPhase.PAGE);
    activeJoin = null;
    this.offset = offset;
    return this;
  }

  @Override
  public QueryDescription build() {
    requireQueryMode("build()");
    if (phase == BuilderPhase.BUILT) throw misuse("build() called twice");
    if (select.isEmpty()) throw new QueryValidationException(MISSING_REQUIRED_CLAUSE, "SELECT list is empty");
    if (from == null && !overTemplate) throw new QueryValidationException(MISSING_REQUIRED_CLAUSE, "FROM is missing");
    advance(BuilderPhase.BUILT, "build()",
        BuilderPhase.FROM, BuilderPhase.JOIN, BuilderPhase.WHERE, BuilderPhase.ORDER, BuilderPhase.PAGE);
    activeJoin = null;

    ConditionGroup w = (where == null || where.group.isEmpty()) ? null : where.group.toGroup();
    return new QueryDescription(select, from, joinClauses(), w, orderBy, limit, offset);
  }

  private List<JoinClause> joinClauses() {
    List<JoinClause> out = new ArrayList<>(joins.size());
    for (JoinDraft j : joins) out.add(new JoinClause(j.kind, j.table, j.alias, j.on.toGroup()));
    return out;
  }

  private void advance(BuilderPhase next, String op, BuilderPhase... allowed) {
    for (BuilderPhase p : allowed) {
      if (p == phase) {
        phase = next;
        return;
      }
    }
    throw misuse(op + " is not allowed in phase " + phase);
  }

  private void requireQueryMode(String op) {
    if (templateName != null) throw misuse(op + " on join template '" + templateName + "'");
  }

  private static QueryValidationException misuse(String message) {
    return new QueryValidationException(BUILDER_MISUSE, message);
  }

  private final class JoinDraft implements JoinBuilder {
    private final JoinKind kind;
    private final String table;
    private final String alias;
    private final GroupDraft on = new GroupDraft();

    JoinDraft(JoinKind kind, String table, String alias) {
      this.kind = kind;
      this.table = table;
      this.alias = alias;
    }

    @Override
    public JoinBuilder onColumn(String left, ComparisonOp op, String right) {
      return append(Combinator.AND, new JoinColumnCondition(left, op, right));
    }

    @Override
    public JoinBuilder onValue(String column, ComparisonOp op, Object value) {
      return append(Combinator.AND, new Condition(column, op, value));
    }

    @Override
    public JoinBuilder orOnColumn(String left, ComparisonOp op, String right) {
      return append(Combinator.OR, new JoinColumnCondition(left, op, right));
    }

    @Override
    public JoinBuilder orOnValue(String column, ComparisonOp op, Object value) {
      return append(Combinator.OR, new Condition(column, op, value));
    }

    @Override
    public JoinBuilder andGroup(Consumer<GroupBuilder> group) {
      ensureActive();
      return append(Combinator.AND, GroupDraft.nested(group, true));
    }

    @Override
    public JoinBuilder orGroup(Consumer<GroupBuilder> group) {
      ensureActive();
      return append(Combinator.OR, GroupDraft.nested(group, true));
    }

    private JoinBuilder append(Combinator connective, ConditionNode node) {
      ensureActive();
      on.append(connective, node);
      return this;
    }

    private void ensureActive() {
      if (phase != BuilderPhase.JOIN || activeJoin != this) {
        throw misuse("ON condition added to join '" + alias + "' which is no longer the active join");
      }
    }

    @Override
    public JoinBuilder join(JoinKind kind, String table, String alias) { return QueryDraft.this.join(kind, table, alias); }

    @Override
    public JoinTemplate buildTemplate() { return QueryDraft.this.buildTemplate(); }

    @Override
    public WhereBuilder where() { return QueryDraft.this.where(); }

    @Override
    public OrderStep orderBy(String target, SortKey.Direction direction) {
      return QueryDraft.this.orderBy(target, direction);
    }

    @Override
    public PageStep limit(int limit) { return QueryDraft.this.limit(limit); }

    @Override
    public PageStep offset(int offset) { return QueryDraft.this.offset(offset); }

    @Override
    public QueryDescription build() { return QueryDraft.this.build(); }
  }

  private final class WhereDraft implements WhereBuilder {
    private final GroupDraft group = new GroupDraft();

    @Override
    public WhereBuilder and(String column, ComparisonOp op, Object value) {
      return append(Combinator.AND, new Condition(column, op, value));
    }

    @Override
    public WhereBuilder and(String column, ComparisonOp op) { return and(column, op, null); }

    @Override
    public WhereBuilder or(String column, ComparisonOp op, Object value) {
      return append(Combinator.OR, new Condition(column, op, value));
    }

    @Override
    public WhereBuilder or(String column, ComparisonOp op) { return or(column, op, null); }

    @Override
    public WhereBuilder andGroup(Consumer<GroupBuilder> body) {
      ensureActive();
      return append(Combinator.AND, GroupDraft.nested(body, false));
    }

    @Override
    public WhereBuilder orGroup(Consumer<GroupBuilder> body) {
      ensureActive();
      return append(Combinator.OR, GroupDraft.nested(body, false));
    }

    private WhereBuilder append(Combinator connective, ConditionNode node) {
      ensureActive();
      group.append(connective, node);
      return this;
    }

    private void ensureActive() {
      if (phase != BuilderPhase.WHERE || where != this) throw misuse("WHERE condition added after the WHERE phase");
    }

    @Override
    public OrderStep orderBy(String target, SortKey.Direction direction) {
      return QueryDraft.this.orderBy(target, direction);
    }

    @Override
    public PageStep limit(int limit) { return QueryDraft.this.limit(limit); }

    @Override
    public PageStep offset(int offset) { return QueryDraft.this.offset(offset); }

    @Override
    public QueryDescription build() { return QueryDraft.this.build(); }
  }
}
