package io.intellixity.catalogq.jdbc.compile;

import io.intellixity.catalogq.query.QueryValidationException;
import io.intellixity.catalogq.schema.SchemaRegistry;
import io.intellixity.catalogq.schema.TableDefinition;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static io.intellixity.catalogq.query.QueryValidationException.Reason.*;

/**
 * Checks column references of one statement against the aliases bound in it (FROM + JOINs).
 * <p>
 * Accepted reference forms: {@code alias.column}, {@code column} (only without joins), and in SELECT also
 * {@code alias.*}, {@code *}, {@code COUNT/SUM/AVG/MAX/MIN(ref)}, {@code COUNT(*)}, each optionally followed by
 * {@code AS name}. Anything else is rejected, so the only text reaching SQL is allow-listed identifiers.
 */
final class ColumnReferenceValidator {
  private static final String IDENT = "[A-Za-z_][A-Za-z0-9_]*";
  private static final Pattern COLUMN_REF = Pattern.compile("(?:(" + IDENT + ")\\.)?(" + IDENT + ")");
  private static final Pattern WILDCARD = Pattern.compile("(?:(" + IDENT + ")\\.)?\\*");
  private static final Pattern AGGREGATE = Pattern.compile("(?i)(COUNT|SUM|AVG|MAX|MIN)\\s*\\(\\s*(.+?)\\s*\\)");
  private static final Pattern OUTPUT_ALIAS = Pattern.compile("(?i)^(.+?)\\s+AS\\s+(" + IDENT + ")$");
  private static final Pattern IDENTIFIER = Pattern.compile(IDENT);

  private final SchemaRegistry registry;
  private final Map<String, TableDefinition> bound;
  private final boolean hasJoins;

  ColumnReferenceValidator(SchemaRegistry registry, Map<String, TableDefinition> bound, boolean hasJoins) {
    this.registry = registry;
    this.bound = bound;
    this.hasJoins = hasJoins;
  }

  /**
   * Validate one SELECT item.
   *
   * @return the output name introduced by {@code AS}, or null
   */
  String validateSelectItem(String item) {
    String expr = item.trim();
    String outputAlias = null;
    Matcher as = OUTPUT_ALIAS.matcher(expr);
    if (as.matches()) {
      expr = as.group(1).trim();
      outputAlias = as.group(2);
    }

    Matcher wc = WILDCARD.matcher(expr);
    if (wc.matches()) {
      if (outputAlias != null) {
        throw new QueryValidationException(UNKNOWN_COLUMN,
            "Wildcard '" + expr + "' cannot be renamed with AS: '" + item + "'");
      }
      if (wc.group(1) == null) requireSingleTable(expr);
      else requireBound(wc.group(1), expr);
      return outputAlias;
    }

    Matcher agg = AGGREGATE.matcher(expr);
    if (agg.matches()) {
      String arg = agg.group(2);
      if (arg.equals("*")) {
        if (!agg.group(1).equalsIgnoreCase("COUNT")) throw notAColumn(item);
      } else {
        validateColumn(arg, "SELECT");
      }
      return outputAlias;
    }

    validateColumn(expr, "SELECT", item);
    return outputAlias;
  }

  /** Validate a plain column reference used in SELECT, ON, WHERE or ORDER BY. */
  void validateColumn(String ref, String clause) {
    validateColumn(ref, clause, ref);
  }

  /** ORDER BY may also name an output alias introduced in SELECT. */
  void validateSortTarget(String target, Set<String> outputAliases) {
    if (IDENTIFIER.matcher(target).matches() && outputAliases.contains(target)) return;
    validateColumn(target, "ORDER BY");
  }

  private void validateColumn(String ref, String clause, String original) {
    Matcher m = COLUMN_REF.matcher(ref.trim());
    if (!m.matches()) throw notAColumn(original);

    String alias = m.group(1);
    String column = m.group(2);
    if (alias == null) {
      if (hasJoins) {
        throw new QueryValidationException(AMBIGUOUS_UNQUALIFIED_COLUMN,
            "Unqualified column '" + column + "' in " + clause + " of a query with joins. "
                + "Qualify every column as alias.column (e.g. 'w.name', 'pc.category_id').");
      }
      return;
    }

    TableDefinition t = requireBound(alias, original);
    if (!t.hasColumn(column)) {
      throw new QueryValidationException(UNKNOWN_COLUMN,
          "Column '" + column + "' is not allowed for alias '" + alias + "' (" + t.qualifiedName() + "). "
              + "Available columns: " + String.join(", ", t.columns()));
    }
  }

  private TableDefinition requireBound(String alias, String ref) {
    TableDefinition t = bound.get(alias);
    if (t != null) return t;
    if (registry.lookup(alias).isPresent()) {
      throw new QueryValidationException(UNKNOWN_ALIAS,
          "Alias '" + alias + "' in '" + ref + "' is not bound by FROM or JOIN in this query. Bound aliases: "
              + String.join(", ", bound.keySet()));
    }
    throw new QueryValidationException(UNKNOWN_ALIAS,
        "Alias '" + alias + "' in '" + ref + "' is not defined in the schema registry. Available aliases: "
            + String.join(", ", registry.aliases()));
  }

  private void requireSingleTable(String ref) {
    if (hasJoins) {
      throw new QueryValidationException(AMBIGUOUS_UNQUALIFIED_COLUMN,
          "Unqualified '" + ref + "' in a query with joins; use alias.* instead");
    }
  }

  private static QueryValidationException notAColumn(String ref) {
    return new QueryValidationException(UNKNOWN_COLUMN, "'" + ref + "' is not a column reference");
  }
}
