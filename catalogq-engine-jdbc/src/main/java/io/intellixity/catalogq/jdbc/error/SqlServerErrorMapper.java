package io.intellixity.catalogq.jdbc.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;

/**
 * Classifies SQL Server driver errors by error number.
 *
 * <pre>
 * 2601, 2627  duplicate key                 CONFLICT        409
 * 547         foreign key / check           CONSTRAINT      409
 * 515         NULL into NOT NULL column     NOT_NULL        400
 * 8152        string or binary truncation   TRUNCATION      422
 * 207, 208    invalid column / object name  UNKNOWN_OBJECT  404
 * 229         permission denied             PERMISSION      403
 * 18456       login failed                  LOGIN           401
 * -2, HYT00   timeout                       TIMEOUT         503
 * 08xxx       connection failure            CONNECTION      503
 * </pre>
 *
 * Everything else is {@code UNKNOWN} (500). The driver message is kept as-is.
 */
public final class SqlServerErrorMapper {
  private static final Logger log = LoggerFactory.getLogger(SqlServerErrorMapper.class);

  public DatabaseException map(SQLException e) {
    DbErrorCategory category = classify(e);
    int code = e.getErrorCode();
    if (category == DbErrorCategory.UNKNOWN) {
      log.warn("catalogq.db_error unmapped code={} sqlState={} message={}", code, e.getSQLState(), e.getMessage());
    } else {
      log.info("catalogq.db_error category={} code={} status={}", category, code, category.httpStatus());
    }
    return new DatabaseException(category, code, e.getMessage(), e);
  }

  public DbErrorCategory classify(SQLException e) {
    if (e instanceof SQLTimeoutException) return DbErrorCategory.TIMEOUT;
    DbErrorCategory byCode = switch (e.getErrorCode()) {
      case 2601, 2627 -> DbErrorCategory.CONFLICT;
      case 547 -> DbErrorCategory.CONSTRAINT;
      case 515 -> DbErrorCategory.NOT_NULL;
      case 8152 -> DbErrorCategory.TRUNCATION;
      case 207, 208 -> DbErrorCategory.UNKNOWN_OBJECT;
      case 229 -> DbErrorCategory.PERMISSION;
      case 18456 -> DbErrorCategory.LOGIN;
      case -2 -> DbErrorCategory.TIMEOUT;
      default -> null;
    };
    if (byCode != null) return byCode;

    String state = e.getSQLState();
    if ("HYT00".equals(state)) return DbErrorCategory.TIMEOUT;
    if (e instanceof SQLTransientConnectionException || (state != null && state.startsWith("08"))) {
      return DbErrorCategory.CONNECTION;
    }
    return DbErrorCategory.UNKNOWN;
  }
}
