package com.sharecost.dto;

import com.sharecost.model.TransactionType;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

/** Body of both creating and updating a transaction. */
@Getter
@Setter
public class ExpenseRequest {
  @NotBlank
  private String description;

  // expenses.amount is NUMERIC(12, 2)
  @NotNull
  @Digits(integer = 10, fraction = 2)
  private BigDecimal amount;

  @NotNull
  private UUID paidBy;

  private List<UUID> splitBetween = new ArrayList<>();

  private TransactionType expenseType = TransactionType.EXPENSE;

  private UUID transferTo;

  private LocalDate expenseDate;

  @Pattern(regexp = "[A-Za-z]{3}", message = "must be a three-letter currency code")
  private String currency;

  // expenses.exchange_rate is NUMERIC(12, 6)
  @Positive
  @Digits(integer = 6, fraction = 6)
  private BigDecimal exchangeRate;
}
