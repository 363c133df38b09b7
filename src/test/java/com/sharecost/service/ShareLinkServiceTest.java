package com.sharecost.service;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sharecost.dto.TokenResponse;
import com.sharecost.exception.AuthInvalidException;
import com.sharecost.exception.ValidationException;
import com.sharecost.model.Capability;
import com.sharecost.model.CapabilitySet;
import com.sharecost.model.CapabilitySets;
import com.sharecost.model.GroupPrincipal;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ShareLinkServiceTest {
  private final UUID groupId = UUID.randomUUID();
  private TokenService tokenService;
  private CapabilityAuthority authority;
  private ShareLinkService shareLinkService;

  @BeforeEach
  void setUp() {
    tokenService = TokenServiceTest.newTokenService();
    authority = new CapabilityAuthority(tokenService);
    shareLinkService = new ShareLinkService(tokenService, authority);
  }

  @Test
  void shareLinkCannotGrantWhatTheCallerLacks() {
    GroupPrincipal caller = new GroupPrincipal(groupId, CapabilitySets.allExcept(Capability.MANAGE_MEMBERS));
    CapabilitySet requested = CapabilitySets.flags(Capability.MANAGE_MEMBERS, true);

    TokenResponse link = shareLinkService.createShareLink(caller, requested);

    assertFalse(link.getCapabilities().isManageMembers());
    GroupPrincipal holder = authority.authenticateToken(link.getToken());
    assertFalse(holder.capabilities().hasManageMembers());
    assertTrue(holder.capabilities().hasAddExpenses());
  }

  @Test
  void shareLinkKeepsRequestedRestrictions() {
    GroupPrincipal caller = new GroupPrincipal(groupId, CapabilitySet.all());
    CapabilitySet requested = CapabilitySets.flags(Capability.DELETE_GROUP, false, Capability.EDIT_EXPENSES, false);

    GroupPrincipal holder = authority.authenticateToken(shareLinkService.createShareLink(caller, requested).getToken());

    assertFalse(holder.capabilities().hasDeleteGroup());
    assertFalse(holder.capabilities().hasEditExpenses());
    assertTrue(holder.capabilities().hasUpdatePayment());
  }

  @Test
  void linksOfLinksNeverEscalate() {
    GroupPrincipal caller = new GroupPrincipal(groupId, CapabilitySets.allExcept(Capability.DELETE_GROUP));
    GroupPrincipal first = authority.authenticateToken(shareLinkService.createShareLink(caller, null).getToken());

    GroupPrincipal second = authority.authenticateToken(
        shareLinkService.createShareLink(first, CapabilitySet.all()).getToken());

    assertFalse(second.capabilities().hasDeleteGroup());
  }

  @Test
  void mergedTokenHoldsRightsOfBoth() {
    String x = tokenService.issue(groupId, CapabilitySets.flags(Capability.ADD_EXPENSES, true, Capability.EDIT_EXPENSES, false));
    String y = tokenService.issue(groupId, CapabilitySets.flags(Capability.ADD_EXPENSES, false, Capability.EDIT_EXPENSES, true));

    TokenResponse merged = shareLinkService.mergeTokens(authority.authenticateToken(x), y);

    assertTrue(merged.getCapabilities().isAddExpenses());
    assertTrue(merged.getCapabilities().isEditExpenses());
    GroupPrincipal holder = authority.authenticateToken(merged.getToken());
    assertTrue(holder.capabilities().hasAddExpenses());
    assertTrue(holder.capabilities().hasEditExpenses());
  }

  @Test
  void tokensOfDifferentGroupsCannotBeMerged() {
    GroupPrincipal caller = new GroupPrincipal(groupId, CapabilitySet.all());
    String foreign = tokenService.issue(UUID.randomUUID(), CapabilitySet.all());

    assertThrows(ValidationException.class, () -> shareLinkService.mergeTokens(caller, foreign));
  }

  @Test
  void invalidSecondTokenIsRejected() {
    GroupPrincipal caller = new GroupPrincipal(groupId, CapabilitySet.all());

    assertThrows(AuthInvalidException.class, () -> shareLinkService.mergeTokens(caller, "forged.token.value"));
  }
}
