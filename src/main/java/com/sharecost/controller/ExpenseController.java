package com.sharecost.controller;

import com.sharecost.dto.ExpenseRequest;
import com.sharecost.dto.ExpenseResponse;
import com.sharecost.service.CurrentGroupService;
import com.sharecost.service.ExpenseService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/groups/current/expenses")
public class ExpenseController {
  private final ExpenseService expenseService;
  private final CurrentGroupService currentGroupService;

  public ExpenseController(ExpenseService expenseService, CurrentGroupService currentGroupService) {
    this.expenseService = expenseService;
    this.currentGroupService = currentGroupService;
  }

  @GetMapping
  public List<ExpenseResponse> list() {
    return expenseService.listExpenses(currentGroupService.requireGroup());
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public ExpenseResponse create(@Valid @RequestBody ExpenseRequest request) {
    return expenseService.createExpense(currentGroupService.requireGroup(), request);
  }

  @PutMapping("/{expenseId}")
  public ExpenseResponse update(@PathVariable UUID expenseId, @Valid @RequestBody ExpenseRequest request) {
    return expenseService.updateExpense(currentGroupService.requireGroup(), expenseId, request);
  }

  @DeleteMapping("/{expenseId}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void delete(@PathVariable UUID expenseId) {
    expenseService.deleteExpense(currentGroupService.requireGroup(), expenseId);
  }
}
