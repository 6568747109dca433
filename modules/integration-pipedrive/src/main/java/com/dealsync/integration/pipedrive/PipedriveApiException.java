package com.dealsync.integration.pipedrive;

import java.util.Objects;

class PipedriveApiException extends RuntimeException {
  private final int statusCode;
  private final String responseBody;

  PipedriveApiException(int statusCode, String responseBody) {
    super("Pipedrive API error status=" + statusCode);
    this.statusCode = statusCode;
    this.responseBody = Objects.requireNonNullElse(responseBody, "");
  }

  int statusCode() {
    return statusCode;
  }

  String responseBody() {
    return responseBody;
  }

  boolean isNotFound() {
    return statusCode == 404;
  }
}
