package com.sharecost.service;

import com.sharecost.exception.AuthInvalidException;
import com.sharecost.exception.AuthMissingException;
import com.sharecost.exception.TokenVerificationException;
import com.sharecost.model.CapabilitySet;
import com.sharecost.model.GroupPrincipal;
import com.sharecost.model.TokenClaims;
import org.springframework.stereotype.Service;

/**
 * Turns an inbound credential into a {@link GroupPrincipal}. It never decides what the principal may
 * do; operations check the capability they need on the principal.
 */
@Service
public class CapabilityAuthority {
  private static final String BEARER_PREFIX = "Bearer ";

  private final TokenService tokenService;

  public CapabilityAuthority(TokenService tokenService) {
    this.tokenService = tokenService;
  }

  /**
   * @param authorizationHeader the raw {@code Authorization} header value, possibly {@code null}
   * @throws AuthMissingException when no credential is present
   * @throws AuthInvalidException when the credential is not a verifiable bearer token
   */
  public GroupPrincipal authenticate(String authorizationHeader) {
    if (authorizationHeader == null || authorizationHeader.isBlank()) {
      throw new AuthMissingException();
    }
    if (!authorizationHeader.startsWith(BEARER_PREFIX)) {
      throw new AuthInvalidException(TokenVerificationException.Reason.MALFORMED);
    }
    return authenticateToken(authorizationHeader.substring(BEARER_PREFIX.length()).trim());
  }

  /** Verifies a bare token, as presented in a request body when merging share links. */
  public GroupPrincipal authenticateToken(String token) {
    TokenClaims claims = verify(token);
    return new GroupPrincipal(claims.groupId(), resolveCapabilities(claims));
  }

  public TokenClaims verify(String token) {
    try {
      return tokenService.verify(token);
    } catch (TokenVerificationException ex) {
      throw new AuthInvalidException(ex);
    }
  }

  /** Tokens without a capability claim predate granular permissions and keep full access. */
  public CapabilitySet resolveCapabilities(TokenClaims claims) {
    return claims.capabilities() == null ? CapabilitySet.all() : claims.capabilities();
  }
}
