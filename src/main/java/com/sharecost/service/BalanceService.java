package com.sharecost.service;

import com.sharecost.dto.BalanceResponse;
import com.sharecost.model.Expense;
import com.sharecost.model.GroupPrincipal;
import com.sharecost.model.LedgerMember;
import com.sharecost.model.LedgerTransaction;
import com.sharecost.model.ShareGroup;
import com.sharecost.model.TransactionType;
import com.sharecost.repository.ExpenseRepository;
import com.sharecost.repository.MemberRepository;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Loads a group's snapshot and reports the ledger engine's balances rounded to cents. */
@Service
public class BalanceService {
  private static final Logger log = LoggerFactory.getLogger(BalanceService.class);
  private static final int REPORTED_SCALE = 2;
  // members get random UUIDs, never the nil one
  static final UUID NO_MEMBER = new UUID(0L, 0L);

  private final GroupService groupService;
  private final MemberRepository memberRepository;
  private final ExpenseRepository expenseRepository;
  private final LedgerEngine ledgerEngine;

  public BalanceService(GroupService groupService,
                        MemberRepository memberRepository,
                        ExpenseRepository expenseRepository,
                        LedgerEngine ledgerEngine) {
    this.groupService = groupService;
    this.memberRepository = memberRepository;
    this.expenseRepository = expenseRepository;
    this.ledgerEngine = ledgerEngine;
  }

  @Transactional(readOnly = true)
  public List<BalanceResponse> balances(GroupPrincipal principal) {
    ShareGroup group = groupService.requireGroup(principal.groupId());
    List<LedgerMember> members = memberRepository.findByGroupId(group.getId()).stream()
        .map(m -> new LedgerMember(m.getId(), m.getName()))
        .toList();
    List<LedgerTransaction> transactions = new ArrayList<>();
    for (Expense expense : expenseRepository.findByGroupId(group.getId())) {
      if (expense.getType() == TransactionType.TRANSFER && expense.getTransferTo() == null) {
        log.warn("Transfer {} in group {} has no target; only the sender is credited",
            expense.getId(), group.getId());
      }
      transactions.add(toLedgerTransaction(expense));
    }

    return ledgerEngine.computeBalances(members, transactions, group.getCurrency()).stream()
        .map(b -> new BalanceResponse(b.memberId(), b.memberName(),
            b.balance().setScale(REPORTED_SCALE, RoundingMode.HALF_UP)))
        .toList();
  }

  /**
   * A stored transfer without a target maps to a transfer towards {@link #NO_MEMBER}, so the ledger
   * engine drops the receiving leg and still credits the sender.
   */
  static LedgerTransaction toLedgerTransaction(Expense expense) {
    boolean transfer = expense.getType() == TransactionType.TRANSFER;
    UUID target = null;
    if (transfer) {
      target = expense.getTransferTo() == null ? NO_MEMBER : expense.getTransferTo();
    }
    return new LedgerTransaction(
        expense.getId(),
        expense.getType(),
        expense.getAmount(),
        expense.getPaidBy(),
        target,
        transfer ? null : expense.getSplitBetween(),
        expense.getCurrency(),
        expense.getExchangeRate());
  }
}
