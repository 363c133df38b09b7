package com.sharecost.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum TransactionType {
  /** Payer covered a cost shared by the split members. */
  EXPENSE,
  /** Payer handed money directly to one other member. */
  TRANSFER,
  /** Payer received money that belongs to the split members. */
  INCOME;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static TransactionType fromWireName(String value) {
    if (value == null || value.isBlank()) {
      return EXPENSE;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown transaction type: " + value, ex);
    }
  }
}
