package com.sharecost.dto;

import com.sharecost.model.TransactionType;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ExpenseResponse {
  private UUID id;
  private UUID groupId;
  private String description;
  private BigDecimal amount;
  private UUID paidBy;
  private List<UUID> splitBetween;
  private TransactionType expenseType;
  private UUID transferTo;
  private String currency;
  private BigDecimal exchangeRate;
  private LocalDate expenseDate;
  private Instant createdAt;
}
