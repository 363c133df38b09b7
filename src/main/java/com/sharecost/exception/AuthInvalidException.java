package com.sharecost.exception;

import org.springframework.http.HttpStatus;

/** A credential was presented but is malformed, wrongly signed or expired. */
public class AuthInvalidException extends ShareCostException {
  private final TokenVerificationException.Reason reason;

  public AuthInvalidException(TokenVerificationException.Reason reason) {
    super(HttpStatus.UNAUTHORIZED, "auth_invalid", "Invalid authentication: " + reason.description());
    this.reason = reason;
  }

  public AuthInvalidException(TokenVerificationException cause) {
    super(HttpStatus.UNAUTHORIZED, "auth_invalid",
        "Invalid authentication: " + cause.getReason().description(), cause);
    this.reason = cause.getReason();
  }

  public TokenVerificationException.Reason getReason() {
    return reason;
  }
}
