package com.homesplit.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "expenses")
@Getter
@Setter
public class Expense {
  private static final int DESCRIPTION_LIMIT = 255;

  @Id
  private UUID id;

  @ManyToOne(optional = false)
  @JoinColumn(name = "household_id")
  private Household household;

  @ManyToOne(optional = false)
  @JoinColumn(name = "paid_by")
  private User paidBy;

  @ManyToOne
  @JoinColumn(name = "created_by")
  private User createdBy;

  @Column(nullable = false, precision = 19, scale = 2)
  private BigDecimal amount;

  @Column(nullable = false)
  private String category;

  @Column
  private String description;

  @Column(name = "expense_date", nullable = false)
  private LocalDate expenseDate;

  @ManyToOne
  @JoinColumn(name = "recurring_expense_id")
  private RecurringExpense recurringExpense;

  /** Set on occurrences materialized from a recurring expense; unique per occurrence. */
  @Column(unique = true, length = 128)
  private String instanceKey;

  @Column(nullable = false)
  private Instant createdAt;

  @Column(nullable = false)
  private Instant updatedAt;

  @PrePersist
  void prePersist() {
    if (id == null) {
      id = UUID.randomUUID();
    }
    if (createdAt == null) {
      createdAt = Instant.now();
    }
    if (updatedAt == null) {
      updatedAt = createdAt;
    }
    description = truncate(description);
  }

  @PreUpdate
  void preUpdate() {
    updatedAt = Instant.now();
    description = truncate(description);
  }

  private static String truncate(String value) {
    if (value == null || value.length() <= DESCRIPTION_LIMIT) {
      return value;
    }
    return value.substring(0, DESCRIPTION_LIMIT);
  }
}
