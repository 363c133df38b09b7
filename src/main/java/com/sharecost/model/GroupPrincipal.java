package com.sharecost.model;

import com.sharecost.exception.AuthForbiddenException;
import java.util.UUID;

/** The authenticated bearer of a group token with its effective capabilities. */
public record GroupPrincipal(UUID groupId, CapabilitySet capabilities) {

  /** Fails with {@link AuthForbiddenException} unless the token grants {@code capability}. */
  public void requireCapability(Capability capability) {
    if (!capabilities.has(capability)) {
      throw new AuthForbiddenException(capability);
    }
  }
}
