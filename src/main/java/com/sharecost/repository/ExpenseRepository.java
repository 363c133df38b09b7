package com.sharecost.repository;

import com.sharecost.model.Expense;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ExpenseRepository extends JpaRepository<Expense, UUID> {
  @Query("select e from Expense e where e.group.id = :groupId order by e.expenseDate desc, e.createdAt desc")
  List<Expense> findByGroupId(@Param("groupId") UUID groupId);

  @Query("select e from Expense e where e.id = :expenseId and e.group.id = :groupId")
  Optional<Expense> findByIdAndGroupId(@Param("expenseId") UUID expenseId, @Param("groupId") UUID groupId);
}
