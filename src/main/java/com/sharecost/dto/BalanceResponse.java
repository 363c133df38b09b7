package com.sharecost.dto;

import java.math.BigDecimal;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

/** Positive balance: the member is owed money. Negative: the member owes. */
@Getter
@AllArgsConstructor
public class BalanceResponse {
  private UUID userId;
  private String userName;
  private BigDecimal balance;
}
