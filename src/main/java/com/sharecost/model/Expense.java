package com.sharecost.model;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

/** A stored group transaction of any {@link TransactionType}. */
@Entity
@Table(name = "expenses")
@Getter
@Setter
public class Expense {
  private static final int DESCRIPTION_LIMIT = 500;

  @Id
  private UUID id;

  @ManyToOne(optional = false)
  @JoinColumn(name = "group_id")
  private ShareGroup group;

  @Column(nullable = false, length = DESCRIPTION_LIMIT)
  private String description;

  @Column(nullable = false, precision = 12, scale = 2)
  private BigDecimal amount;

  @Column(name = "paid_by", nullable = false)
  private UUID paidBy;

  @Enumerated(EnumType.STRING)
  @Column(name = "expense_type", nullable = false, length = 20)
  private TransactionType type;

  @Column(name = "transfer_to")
  private UUID transferTo;

  @Column(nullable = false, length = 3)
  private String currency;

  @Column(nullable = false, precision = 12, scale = 6)
  private BigDecimal exchangeRate;

  @ElementCollection(fetch = FetchType.EAGER)
  @CollectionTable(name = "expense_splits", joinColumns = @JoinColumn(name = "expense_id"))
  @Column(name = "member_id", nullable = false)
  private Set<UUID> splitBetween = new LinkedHashSet<>();

  @Column(nullable = false)
  private LocalDate expenseDate;

  @Column(nullable = false)
  private Instant createdAt;

  @PrePersist
  void prePersist() {
    if (id == null) {
      id = UUID.randomUUID();
    }
    if (createdAt == null) {
      createdAt = Instant.now();
    }
    if (expenseDate == null) {
      expenseDate = LocalDate.now();
    }
    if (exchangeRate == null) {
      exchangeRate = BigDecimal.ONE;
    }
    if (type == null) {
      type = TransactionType.EXPENSE;
    }
    normalizeLengths();
  }

  @PreUpdate
  void preUpdate() {
    normalizeLengths();
  }

  private void normalizeLengths() {
    if (description != null && description.length() > DESCRIPTION_LIMIT) {
      description = description.substring(0, DESCRIPTION_LIMIT);
    }
  }
}
