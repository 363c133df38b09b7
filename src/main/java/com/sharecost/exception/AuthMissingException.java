package com.sharecost.exception;

import org.springframework.http.HttpStatus;

/** No bearer credential was presented. */
public class AuthMissingException extends ShareCostException {

  public AuthMissingException() {
    super(HttpStatus.UNAUTHORIZED, "auth_missing", "Missing authentication");
  }
}
