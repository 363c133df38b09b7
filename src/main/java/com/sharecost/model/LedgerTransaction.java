package com.sharecost.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Ledger input for one transaction. A transfer names a target and never a split; an expense or an
 * income names a split and never a target. The constructor rejects any other combination.
 *
 * @param currency transaction currency, {@code null} meaning the group currency
 * @param exchangeRate factor converting {@code amount} into the group currency
 */
public record LedgerTransaction(
    UUID id,
    TransactionType type,
    BigDecimal amount,
    UUID payerId,
    UUID transferTo,
    Set<UUID> splitBetween,
    String currency,
    BigDecimal exchangeRate) {

  public LedgerTransaction {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(amount, "amount");
    Objects.requireNonNull(payerId, "payerId");
    splitBetween = splitBetween == null
        ? Collections.emptySet()
        : Collections.unmodifiableSet(new LinkedHashSet<>(splitBetween));
    exchangeRate = exchangeRate == null ? BigDecimal.ONE : exchangeRate;
    if (type == TransactionType.TRANSFER) {
      if (transferTo == null) {
        throw new IllegalArgumentException("A transfer needs a target member");
      }
      if (!splitBetween.isEmpty()) {
        throw new IllegalArgumentException("A transfer cannot be split");
      }
    } else if (transferTo != null) {
      throw new IllegalArgumentException("Only transfers have a target member");
    }
  }

  public static LedgerTransaction expense(BigDecimal amount, UUID payerId, Set<UUID> splitBetween) {
    return new LedgerTransaction(null, TransactionType.EXPENSE, amount, payerId, null, splitBetween, null, null);
  }

  public static LedgerTransaction transfer(BigDecimal amount, UUID payerId, UUID transferTo) {
    return new LedgerTransaction(null, TransactionType.TRANSFER, amount, payerId, transferTo, null, null, null);
  }

  public static LedgerTransaction income(BigDecimal amount, UUID receiverId, Set<UUID> splitBetween) {
    return new LedgerTransaction(null, TransactionType.INCOME, amount, receiverId, null, splitBetween, null, null);
  }

  public LedgerTransaction inCurrency(String currency, BigDecimal exchangeRate) {
    return new LedgerTransaction(id, type, amount, payerId, transferTo, splitBetween, currency, exchangeRate);
  }
}
