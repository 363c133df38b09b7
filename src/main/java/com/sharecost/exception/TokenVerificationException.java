package com.sharecost.exception;

/**
 * Raised by the token codec when a token cannot be accepted. Never retried: a token that failed
 * verification cannot become valid.
 */
public class TokenVerificationException extends RuntimeException {
  private final Reason reason;

  public TokenVerificationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public TokenVerificationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }

  public enum Reason {
    MALFORMED("malformed token"),
    SIGNATURE_MISMATCH("signature mismatch"),
    EXPIRED("token expired");

    private final String description;

    Reason(String description) {
      this.description = description;
    }

    public String description() {
      return description;
    }
  }
}
