package com.sharecost.exception;

import org.springframework.http.HttpStatus;

/** A caller-supplied value is unparseable or refers to something outside the caller's group. */
public class ValidationException extends ShareCostException {

  public ValidationException(String message) {
    super(HttpStatus.BAD_REQUEST, "validation_error", message);
  }
}
