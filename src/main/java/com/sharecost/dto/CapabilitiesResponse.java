package com.sharecost.dto;

import com.sharecost.model.CapabilitySet;
import lombok.AllArgsConstructor;
import lombok.Getter;

/** Resolved capability flags, spelled out for clients. */
@Getter
@AllArgsConstructor
public class CapabilitiesResponse {
  private boolean deleteGroup;
  private boolean manageMembers;
  private boolean updatePayment;
  private boolean addExpenses;
  private boolean editExpenses;

  public static CapabilitiesResponse from(CapabilitySet capabilities) {
    return new CapabilitiesResponse(
        capabilities.hasDeleteGroup(),
        capabilities.hasManageMembers(),
        capabilities.hasUpdatePayment(),
        capabilities.hasAddExpenses(),
        capabilities.hasEditExpenses());
  }
}
