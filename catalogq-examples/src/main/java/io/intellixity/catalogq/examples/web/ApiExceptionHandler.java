package io.intellixity.catalogq.examples.web;

import io.intellixity.catalogq.jdbc.error.DatabaseException;
import io.intellixity.catalogq.query.QueryValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Maps failures to {@link ApiErrorResponse}: bad query shape 400, database errors by category, the rest 500. */
@RestControllerAdvice
public final class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(QueryValidationException.class)
  public ResponseEntity<ApiErrorResponse> invalidQuery(QueryValidationException e) {
    log.warn("catalogq.api rejected reason={} message={}", e.reason(), e.getMessage());
    return respond(400, e.reason().name(), e.getMessage());
  }

  @ExceptionHandler(DatabaseException.class)
  public ResponseEntity<ApiErrorResponse> database(DatabaseException e) {
    log.error("catalogq.api db_error category={} code={}", e.category(), e.vendorCode(), e);
    return respond(e.httpStatus(), e.category().name(), e.getMessage());
  }

  /** Malformed JSON; grammar errors raised while reading the payload arrive wrapped in here. */
  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> unreadable(HttpMessageNotReadableException e) {
    for (Throwable t = e; t != null; t = t.getCause()) {
      if (t instanceof QueryValidationException qve) return invalidQuery(qve);
      if (t instanceof IllegalArgumentException iae) return badRequest(iae);
    }
    log.warn("catalogq.api unreadable body: {}", e.getMessage());
    return respond(400, "BAD_REQUEST", "Malformed request body");
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> badRequest(IllegalArgumentException e) {
    log.warn("catalogq.api bad request: {}", e.getMessage());
    return respond(400, "BAD_REQUEST", e.getMessage());
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> badParameter(MethodArgumentTypeMismatchException e) {
    return respond(400, "BAD_REQUEST", "Invalid value for parameter '" + e.getName() + "'");
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiErrorResponse> unexpected(Exception e) {
    // missing parameters, unsupported method or media type
    if (e instanceof ErrorResponse er) {
      int status = er.getStatusCode().value();
      HttpStatus known = HttpStatus.resolve(status);
      return respond(status, known == null ? "HTTP_" + status : known.name(), e.getMessage());
    }
    log.error("catalogq.api unexpected failure", e);
    return respond(500, "INTERNAL_ERROR", "Internal server error");
  }

  private static ResponseEntity<ApiErrorResponse> respond(int status, String code, String message) {
    return ResponseEntity.status(status).body(ApiErrorResponse.of(status, code, message));
  }
}
