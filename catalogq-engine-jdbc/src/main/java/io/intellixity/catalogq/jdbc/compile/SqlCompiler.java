package io.intellixity.catalogq.jdbc.compile;

import io.intellixity.catalogq.query.*;
import io.intellixity.catalogq.schema.JoinTemplate;
import io.intellixity.catalogq.schema.JoinTemplateRegistry;
import io.intellixity.catalogq.schema.SchemaRegistry;
import io.intellixity.catalogq.schema.TableDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static io.intellixity.catalogq.query.QueryValidationException.Reason.*;

/**
 * Turns a {@link QueryDescription} into SQL Server SQL with {@code @pN} placeholders.
 * <p>
 * Every table, alias and column that ends up in the SQL text is checked against the {@link SchemaRegistry}; values
 * only ever travel in the parameter map. Compilation is pure and reentrant: all per-call state lives in a
 * {@link RenderContext}.
 */
public final class SqlCompiler {
  private static final Logger log = LoggerFactory.getLogger(SqlCompiler.class);

  private final SchemaRegistry registry;
  private final JoinTemplateRegistry templates;

  public SqlCompiler(SchemaRegistry registry, JoinTemplateRegistry templates) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.templates = Objects.requireNonNull(templates, "templates");
  }

  public SqlCompiler(SchemaRegistry registry) {
    this(registry, new JoinTemplateRegistry());
  }

  public SqlStatement compile(QueryDescription q) {
    return compile(q, CompileOptions.none());
  }

  public SqlStatement compile(QueryDescription q, CompileOptions options) {
    Objects.requireNonNull(q, "query");
    CompileOptions opts = (options == null) ? CompileOptions.none() : options;

    // 1. FROM source and the joins that go with it
    TableRef from;
    List<JoinClause> joins;
    String resolvedFrom;
    if (opts.namedTemplate() != null) {
      JoinTemplate t = templates.lookup(opts.namedTemplate()).orElseThrow(() -> new QueryValidationException(
          UNKNOWN_TEMPLATE, "Join template '" + opts.namedTemplate() + "' is not defined. Available templates: "
          + String.join(", ", templates.names())));
      if (q.hasJoins()) {
        throw new QueryValidationException(TEMPLATE_VIOLATION,
            "Query compiled against join template '" + t.name() + "' must not add joins");
      }
      if (q.from() != null) {
        log.warn("catalogq.compile template={} ignoring caller from={}", t.name(), q.from());
      }
      from = t.from();
      joins = t.joins();
      resolvedFrom = t.name();
    } else {
      from = (opts.fixedFrom() != null) ? opts.fixedFrom() : q.from();
      if (from == null) throw new QueryValidationException(MISSING_REQUIRED_CLAUSE, "Query requires a FROM clause");
      joins = q.joins();
      resolvedFrom = from.table();
    }

    // 2. + 4. alias/table bindings
    Map<String, TableDefinition> bound = new LinkedHashMap<>();
    bind(bound, from.alias(), from.table(), "FROM");
    for (JoinClause j : joins) {
      if (j.alias() == null) {
        throw new QueryValidationException(ANONYMOUS_JOIN,
            "JOIN of table '" + j.table() + "' has no alias; every join must be aliased");
      }
      bind(bound, j.alias(), j.table(), "JOIN");
    }

    // 3. SELECT
    if (q.select().isEmpty()) throw new QueryValidationException(MISSING_REQUIRED_CLAUSE, "SELECT list is empty");
    ColumnReferenceValidator columns = new ColumnReferenceValidator(registry, bound, !joins.isEmpty());
    Set<String> outputAliases = new HashSet<>();
    for (String item : q.select()) {
      String out = columns.validateSelectItem(item);
      if (out != null) outputAliases.add(out);
    }

    RenderContext ctx = new RenderContext();
    StringBuilder sql = new StringBuilder(256);
    sql.append("SELECT ").append(String.join(", ", q.select()))
        .append(" FROM ").append(from.table()).append(' ').append(from.alias());

    // 5. + 6. ON clauses take parameters before WHERE, matching their textual order
    for (JoinClause j : joins) {
      String on = render(j.on(), ctx, columns, true);
      if (on.isEmpty()) {
        throw new QueryValidationException(MISSING_REQUIRED_CLAUSE,
            "JOIN '" + j.table() + " " + j.alias() + "' has an empty ON clause");
      }
      sql.append(' ').append(j.kind().sql()).append(' ').append(j.table()).append(' ').append(j.alias())
          .append(" ON ").append(on);
    }

    boolean hasWhere = false;
    if (q.where() != null) {
      String where = render(q.where(), ctx, columns, false);
      if (!where.isEmpty()) {
        sql.append(" WHERE ").append(where);
        hasWhere = true;
      }
    }

    // 7. ORDER BY and paging
    boolean limited = q.limit() != null && q.limit() > 0;
    boolean skipped = q.offset() != null && q.offset() > 0;
    if (!q.orderBy().isEmpty()) {
      List<String> keys = new ArrayList<>(q.orderBy().size());
      for (SortKey sk : q.orderBy()) {
        columns.validateSortTarget(sk.target(), outputAliases);
        keys.add(sk.target() + " " + sk.direction().name());
      }
      sql.append(" ORDER BY ").append(String.join(", ", keys));
    } else if (limited || skipped) {
      // OFFSET/FETCH is only valid after ORDER BY
      sql.append(" ORDER BY (SELECT NULL)");
    }
    int offset = (q.offset() == null) ? 0 : q.offset();
    if (limited) {
      sql.append(" OFFSET ").append(offset).append(" ROWS FETCH NEXT ").append(q.limit()).append(" ROWS ONLY");
    } else if (skipped) {
      sql.append(" OFFSET ").append(offset).append(" ROWS");
    }

    String text = sql.toString().trim().replaceAll("\\s+", " ");
    QueryMetadata meta = new QueryMetadata(q.select(), !joins.isEmpty(), hasWhere, ctx.parameterCount(), resolvedFrom);
    if (log.isDebugEnabled()) {
      log.debug("catalogq.compile from={} joins={} paramCount={} sql={}",
          resolvedFrom, joins.size(), ctx.parameterCount(), text);
    }
    return new SqlStatement(text, ctx.parameters(), meta);
  }

  private void bind(Map<String, TableDefinition> bound, String alias, String table, String clause) {
    if (alias == null) {
      throw new QueryValidationException(UNKNOWN_ALIAS, clause + " table '" + table + "' has no alias");
    }
    TableDefinition def = registry.require(alias);
    if (!def.matchesTable(table)) {
      throw new QueryValidationException(ALIAS_TABLE_MISMATCH,
          clause + " alias '" + alias + "' is defined for table '" + def.qualifiedName()
              + "', but was used for table '" + table + "'");
    }
    if (bound.putIfAbsent(alias, def) != null) {
      throw new QueryValidationException(ALIAS_TABLE_MISMATCH,
          "Alias '" + alias + "' is bound more than once in one statement");
    }
  }

  /** Render a group; empty groups (and groups whose children are all empty) render as "". */
  private static String render(ConditionGroup root, RenderContext ctx, ColumnReferenceValidator columns, boolean inOn) {
    return root.accept(new ConditionVisitor<String>() {
      @Override
      public String visit(Condition c) {
        columns.validateColumn(c.target(), inOn ? "ON" : "WHERE");
        ComparisonOp op = c.operator();
        if (!op.takesValue()) return c.target() + " " + op.sql();
        if (op.takesList()) {
          List<Object> values = c.values();
          if (values.isEmpty()) return "1=0";
          List<String> ph = new ArrayList<>(values.size());
          for (Object v : values) ph.add(ctx.bind(v));
          return c.target() + " " + op.sql() + " (" + String.join(", ", ph) + ")";
        }
        return c.target() + " " + op.sql() + " " + ctx.bind(c.value());
      }

      @Override
      public String visit(JoinColumnCondition c) {
        if (!inOn) {
          throw new QueryValidationException(UNSUPPORTED_CONDITION_NODE,
              "Column-to-column condition '" + c.left() + " " + c.operator().sql() + " " + c.right()
                  + "' is only allowed in ON clauses");
        }
        columns.validateColumn(c.left(), "ON");
        columns.validateColumn(c.right(), "ON");
        return c.left() + " " + c.operator().sql() + " " + c.right();
      }

      @Override
      public String visit(ConditionGroup g) {
        List<String> parts = new ArrayList<>(g.children().size());
        for (ConditionNode child : g.children()) {
          String s = child.accept(this);
          if (!s.isEmpty()) parts.add(s);
        }
        if (parts.isEmpty()) return "";
        return "(" + String.join(" " + g.combinator().name() + " ", parts) + ")";
      }
    });
  }
}
