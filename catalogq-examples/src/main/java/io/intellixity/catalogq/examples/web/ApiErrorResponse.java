package io.intellixity.catalogq.examples.web;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record ApiErrorResponse(boolean success,
                               String message,
                               @JsonProperty("status_code") int statusCode,
                               @JsonProperty("error_code") String errorCode,
                               ResponseMeta meta) {
  public static ApiErrorResponse of(int status, String errorCode, String message) {
    return new ApiErrorResponse(false, message, status, errorCode, ResponseMeta.now());
  }

  public record ResponseMeta(String timestamp) {
    static ResponseMeta now() { return new ResponseMeta(Instant.now().toString()); }
  }
}
