package com.sharecost.service;

import com.sharecost.model.LedgerMember;
import com.sharecost.model.LedgerTransaction;
import com.sharecost.model.MemberBalance;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Computes every member's net balance from a group's full transaction history.
 *
 * <p>Nothing is cached or stored: balances are derived from scratch on each call, and every
 * transaction contributes independently, so the result does not depend on transaction order. Legs
 * that reference a member missing from {@code members} are dropped. An expense or income with an
 * empty split changes nothing.
 *
 * <p>Per-member shares are computed at {@value #SHARE_SCALE} decimal places; remainders are not
 * reconciled across transactions.
 */
@Component
public class LedgerEngine {
  static final int SHARE_SCALE = 8;

  public List<MemberBalance> computeBalances(List<LedgerMember> members,
                                             Collection<LedgerTransaction> transactions,
                                             String groupCurrency) {
    Map<UUID, BigDecimal> balances = new LinkedHashMap<>();
    for (LedgerMember member : members) {
      balances.put(member.id(), BigDecimal.ZERO);
    }

    for (LedgerTransaction tx : transactions) {
      BigDecimal amount = normalize(tx, groupCurrency);
      switch (tx.type()) {
        case TRANSFER -> {
          // the sender is owed the money back, the receiver owes it
          credit(balances, tx.payerId(), amount);
          credit(balances, tx.transferTo(), amount.negate());
        }
        case INCOME -> {
          if (tx.splitBetween().isEmpty()) {
            continue;
          }
          // the receiver holds money that belongs to the split members
          credit(balances, tx.payerId(), amount.negate());
          creditEach(balances, tx.splitBetween(), share(amount, tx.splitBetween()));
        }
        case EXPENSE -> {
          if (tx.splitBetween().isEmpty()) {
            continue;
          }
          credit(balances, tx.payerId(), amount);
          creditEach(balances, tx.splitBetween(), share(amount, tx.splitBetween()).negate());
        }
      }
    }

    List<MemberBalance> result = new ArrayList<>(members.size());
    for (LedgerMember member : members) {
      result.add(new MemberBalance(member.id(), member.name(), balances.get(member.id())));
    }
    return result;
  }

  /** Converts the amount into the group currency. Same-currency transactions ignore their rate. */
  BigDecimal normalize(LedgerTransaction tx, String groupCurrency) {
    if (tx.currency() == null || tx.currency().equalsIgnoreCase(groupCurrency)) {
      return tx.amount();
    }
    return tx.amount().multiply(tx.exchangeRate());
  }

  private static BigDecimal share(BigDecimal amount, Set<UUID> split) {
    return amount.divide(BigDecimal.valueOf(split.size()), SHARE_SCALE, RoundingMode.HALF_EVEN);
  }

  private static void creditEach(Map<UUID, BigDecimal> balances, Set<UUID> memberIds, BigDecimal amount) {
    for (UUID memberId : memberIds) {
      credit(balances, memberId, amount);
    }
  }

  private static void credit(Map<UUID, BigDecimal> balances, UUID memberId, BigDecimal amount) {
    BigDecimal current = balances.get(memberId);
    if (current != null) {
      balances.put(memberId, current.add(amount));
    }
  }
}
