package com.sharecost.service;

import com.sharecost.dto.CapabilitiesResponse;
import com.sharecost.dto.TokenResponse;
import com.sharecost.exception.ValidationException;
import com.sharecost.model.CapabilitySet;
import com.sharecost.model.GroupPrincipal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Mints tokens derived from the caller's own token. Nothing is stored: the issued token is the only
 * record of the rights it carries.
 */
@Service
public class ShareLinkService {
  private static final Logger log = LoggerFactory.getLogger(ShareLinkService.class);

  private final TokenService tokenService;
  private final CapabilityAuthority capabilityAuthority;

  public ShareLinkService(TokenService tokenService, CapabilityAuthority capabilityAuthority) {
    this.tokenService = tokenService;
    this.capabilityAuthority = capabilityAuthority;
  }

  /**
   * Issues a share link for the caller's group. The requested rights are attenuated by the caller's,
   * so a link never grants more than the token that created it.
   *
   * @param requested requested rights; {@code null} asks for everything the caller holds
   */
  public TokenResponse createShareLink(GroupPrincipal caller, CapabilitySet requested) {
    CapabilitySet wanted = requested == null ? CapabilitySet.all() : requested;
    CapabilitySet granted = wanted.capBy(caller.capabilities());
    log.info("Issued share link for group {} with {}", caller.groupId(), granted);
    return issue(caller, granted);
  }

  /**
   * Combines the caller's token with another token of the same group, as happens when someone
   * imports a second share link. The result holds every right either token holds.
   */
  public TokenResponse mergeTokens(GroupPrincipal caller, String otherToken) {
    GroupPrincipal other = capabilityAuthority.authenticateToken(otherToken);
    if (!other.groupId().equals(caller.groupId())) {
      throw new ValidationException("Tokens belong to different groups");
    }
    CapabilitySet merged = caller.capabilities().unionWith(other.capabilities());
    log.info("Merged tokens for group {} into {}", caller.groupId(), merged);
    return issue(caller, merged);
  }

  public CapabilitiesResponse describe(GroupPrincipal caller) {
    return CapabilitiesResponse.from(caller.capabilities());
  }

  private TokenResponse issue(GroupPrincipal caller, CapabilitySet capabilities) {
    String token = tokenService.issue(caller.groupId(), capabilities);
    return new TokenResponse(token, caller.groupId(), CapabilitiesResponse.from(capabilities));
  }
}
