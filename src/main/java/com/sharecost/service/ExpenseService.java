package com.sharecost.service;

import com.sharecost.dto.ExpenseRequest;
import com.sharecost.dto.ExpenseResponse;
import com.sharecost.exception.ValidationException;
import com.sharecost.model.Capability;
import com.sharecost.model.Expense;
import com.sharecost.model.GroupPrincipal;
import com.sharecost.model.Member;
import com.sharecost.model.ShareGroup;
import com.sharecost.model.TransactionType;
import com.sharecost.repository.ExpenseRepository;
import com.sharecost.repository.MemberRepository;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
public class ExpenseService {
  private final ExpenseRepository expenseRepository;
  private final MemberRepository memberRepository;
  private final GroupService groupService;

  public ExpenseService(ExpenseRepository expenseRepository,
                        MemberRepository memberRepository,
                        GroupService groupService) {
    this.expenseRepository = expenseRepository;
    this.memberRepository = memberRepository;
    this.groupService = groupService;
  }

  @Transactional(readOnly = true)
  public List<ExpenseResponse> listExpenses(GroupPrincipal principal) {
    return expenseRepository.findByGroupId(principal.groupId()).stream()
        .map(this::toResponse)
        .collect(Collectors.toList());
  }

  @Transactional
  public ExpenseResponse createExpense(GroupPrincipal principal, ExpenseRequest request) {
    principal.requireCapability(Capability.ADD_EXPENSES);
    ShareGroup group = groupService.requireGroup(principal.groupId());
    Expense expense = new Expense();
    expense.setGroup(group);
    apply(expense, group, request);
    return toResponse(expenseRepository.save(expense));
  }

  @Transactional
  public ExpenseResponse updateExpense(GroupPrincipal principal, UUID expenseId, ExpenseRequest request) {
    principal.requireCapability(Capability.EDIT_EXPENSES);
    Expense expense = requireExpense(principal.groupId(), expenseId);
    apply(expense, expense.getGroup(), request);
    return toResponse(expenseRepository.save(expense));
  }

  @Transactional
  public void deleteExpense(GroupPrincipal principal, UUID expenseId) {
    principal.requireCapability(Capability.EDIT_EXPENSES);
    expenseRepository.delete(requireExpense(principal.groupId(), expenseId));
  }

  private void apply(Expense expense, ShareGroup group, ExpenseRequest request) {
    Set<UUID> memberIds = memberRepository.findByGroupId(group.getId()).stream()
        .map(Member::getId)
        .collect(Collectors.toSet());
    TransactionType type = request.getExpenseType() == null ? TransactionType.EXPENSE : request.getExpenseType();

    requireMemberOf(memberIds, request.getPaidBy(), "paid_by");
    Set<UUID> split = new LinkedHashSet<>();
    UUID transferTo = null;
    if (type == TransactionType.TRANSFER) {
      if (request.getTransferTo() == null) {
        throw new ValidationException("A transfer needs transfer_to");
      }
      requireMemberOf(memberIds, request.getTransferTo(), "transfer_to");
      transferTo = request.getTransferTo();
    } else if (request.getSplitBetween() != null) {
      for (UUID memberId : request.getSplitBetween()) {
        requireMemberOf(memberIds, memberId, "split_between");
        split.add(memberId);
      }
    }

    expense.setDescription(request.getDescription().trim());
    expense.setAmount(request.getAmount());
    expense.setPaidBy(request.getPaidBy());
    expense.setType(type);
    expense.setTransferTo(transferTo);
    expense.getSplitBetween().clear();
    expense.getSplitBetween().addAll(split);
    expense.setExpenseDate(request.getExpenseDate() == null ? LocalDate.now() : request.getExpenseDate());

    String currency = request.getCurrency() == null || request.getCurrency().isBlank()
        ? group.getCurrency()
        : request.getCurrency().trim().toUpperCase(Locale.ROOT);
    expense.setCurrency(currency);
    expense.setExchangeRate(currency.equals(group.getCurrency()) || request.getExchangeRate() == null
        ? BigDecimal.ONE
        : request.getExchangeRate());
  }

  private static void requireMemberOf(Set<UUID> memberIds, UUID memberId, String field) {
    if (memberId == null || !memberIds.contains(memberId)) {
      throw new ValidationException(field + " must reference a member of this group: " + memberId);
    }
  }

  private Expense requireExpense(UUID groupId, UUID expenseId) {
    return expenseRepository.findByIdAndGroupId(expenseId, groupId)
        .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Expense not found"));
  }

  private ExpenseResponse toResponse(Expense expense) {
    return new ExpenseResponse(
        expense.getId(),
        expense.getGroup().getId(),
        expense.getDescription(),
        expense.getAmount(),
        expense.getPaidBy(),
        new ArrayList<>(expense.getSplitBetween()),
        expense.getType(),
        expense.getTransferTo(),
        expense.getCurrency(),
        expense.getExchangeRate(),
        expense.getExpenseDate(),
        expense.getCreatedAt());
  }
}
