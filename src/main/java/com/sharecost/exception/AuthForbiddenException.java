package com.sharecost.exception;

import com.sharecost.model.Capability;
import org.springframework.http.HttpStatus;

/** The credential is valid but lacks the capability the operation requires. */
public class AuthForbiddenException extends ShareCostException {
  private final Capability capability;

  public AuthForbiddenException(Capability capability) {
    super(HttpStatus.FORBIDDEN, "auth_forbidden",
        "Token does not grant the " + capability.wireName() + " capability");
    this.capability = capability;
  }

  public Capability getCapability() {
    return capability;
  }
}
