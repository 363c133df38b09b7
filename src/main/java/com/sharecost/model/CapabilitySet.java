package com.sharecost.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.EnumMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Immutable set of the five group permissions carried by a token.
 *
 * <p>Every flag is nullable. An unset flag is granted, so tokens minted before granular permissions
 * existed keep full access. {@link #has(Capability)} is the only place that resolution happens.
 *
 * <p>On the wire the compact names ({@code dg, mm, up, ae, ee}) are written and both the compact and
 * the verbose names ({@code delete_group, manage_members, ...}) are read. Unset flags are omitted.
 *
 * <p>Two sets are equal when they grant the same capabilities, whether a flag is unset or
 * explicitly {@code true}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CapabilitySet {
  private static final CapabilitySet ALL = new CapabilitySet(true, true, true, true, true);

  @JsonProperty("dg")
  private final Boolean deleteGroup;

  @JsonProperty("mm")
  private final Boolean manageMembers;

  @JsonProperty("up")
  private final Boolean updatePayment;

  @JsonProperty("ae")
  private final Boolean addExpenses;

  @JsonProperty("ee")
  private final Boolean editExpenses;

  @JsonCreator
  public CapabilitySet(
      @JsonProperty("dg") @JsonAlias({"delete_group"}) Boolean deleteGroup,
      @JsonProperty("mm") @JsonAlias({"manage_members"}) Boolean manageMembers,
      @JsonProperty("up") @JsonAlias({"update_payment"}) Boolean updatePayment,
      @JsonProperty("ae") @JsonAlias({"add_expenses"}) Boolean addExpenses,
      @JsonProperty("ee") @JsonAlias({"edit_expenses"}) Boolean editExpenses) {
    this.deleteGroup = deleteGroup;
    this.manageMembers = manageMembers;
    this.updatePayment = updatePayment;
    this.addExpenses = addExpenses;
    this.editExpenses = editExpenses;
  }

  /** Every capability explicitly granted. Issued to whoever creates a group. */
  public static CapabilitySet all() {
    return ALL;
  }

  public static CapabilitySet of(Map<Capability, Boolean> flags) {
    return new CapabilitySet(
        flags.get(Capability.DELETE_GROUP),
        flags.get(Capability.MANAGE_MEMBERS),
        flags.get(Capability.UPDATE_PAYMENT),
        flags.get(Capability.ADD_EXPENSES),
        flags.get(Capability.EDIT_EXPENSES));
  }

  public boolean has(Capability capability) {
    Boolean flag = raw(capability);
    return flag == null || flag;
  }

  public boolean hasDeleteGroup() {
    return has(Capability.DELETE_GROUP);
  }

  public boolean hasManageMembers() {
    return has(Capability.MANAGE_MEMBERS);
  }

  public boolean hasUpdatePayment() {
    return has(Capability.UPDATE_PAYMENT);
  }

  public boolean hasAddExpenses() {
    return has(Capability.ADD_EXPENSES);
  }

  public boolean hasEditExpenses() {
    return has(Capability.EDIT_EXPENSES);
  }

  public boolean hasAll() {
    for (Capability capability : Capability.values()) {
      if (!has(capability)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Attenuates this set by the issuer's own rights: a flag survives only if both sides grant it. A
   * derived token can therefore never exceed its issuer, however often it is re-derived.
   */
  public CapabilitySet capBy(CapabilitySet caller) {
    Map<Capability, Boolean> flags = new EnumMap<>(Capability.class);
    for (Capability capability : Capability.values()) {
      flags.put(capability, has(capability) && caller.has(capability));
    }
    return of(flags);
  }

  /** Combines two tokens of the same group: a flag is granted if either side grants it. */
  public CapabilitySet unionWith(CapabilitySet other) {
    Map<Capability, Boolean> flags = new EnumMap<>(Capability.class);
    for (Capability capability : Capability.values()) {
      flags.put(capability, has(capability) || other.has(capability));
    }
    return of(flags);
  }

  /** The flag as stored, {@code null} when unset. */
  public Boolean raw(Capability capability) {
    return switch (capability) {
      case DELETE_GROUP -> deleteGroup;
      case MANAGE_MEMBERS -> manageMembers;
      case UPDATE_PAYMENT -> updatePayment;
      case ADD_EXPENSES -> addExpenses;
      case EDIT_EXPENSES -> editExpenses;
    };
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CapabilitySet)) {
      return false;
    }
    CapabilitySet other = (CapabilitySet) o;
    for (Capability capability : Capability.values()) {
      if (has(capability) != other.has(capability)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    int hash = 0;
    for (Capability capability : Capability.values()) {
      hash = (hash << 1) | (has(capability) ? 1 : 0);
    }
    return hash;
  }

  @Override
  public String toString() {
    StringJoiner joiner = new StringJoiner(", ", "CapabilitySet{", "}");
    for (Capability capability : Capability.values()) {
      Boolean flag = raw(capability);
      joiner.add(capability.wireName() + "=" + (flag == null ? "unset" : flag));
    }
    return joiner.toString();
  }
}
