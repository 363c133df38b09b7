package com.sharecost.exception;

import org.springframework.http.HttpStatus;

/**
 * Base exception for failures reported to API callers. Carries the HTTP status and a stable error
 * code so the routing layer can tell auth failures apart from validation failures.
 */
public abstract class ShareCostException extends RuntimeException {
  private final HttpStatus status;
  private final String code;

  protected ShareCostException(HttpStatus status, String code, String message) {
    super(message);
    this.status = status;
    this.code = code;
  }

  protected ShareCostException(HttpStatus status, String code, String message, Throwable cause) {
    super(message, cause);
    this.status = status;
    this.code = code;
  }

  public HttpStatus getStatus() {
    return status;
  }

  public String getCode() {
    return code;
  }
}
