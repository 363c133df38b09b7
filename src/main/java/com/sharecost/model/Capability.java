package com.sharecost.model;

/**
 * The permissions a group token may carry. Each mutating operation requires exactly one of them.
 */
public enum Capability {
  DELETE_GROUP("delete_group"),
  MANAGE_MEMBERS("manage_members"),
  UPDATE_PAYMENT("update_payment"),
  ADD_EXPENSES("add_expenses"),
  EDIT_EXPENSES("edit_expenses");

  private final String wireName;

  Capability(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }
}
