package com.homesplit.model;

import com.homesplit.engine.SettlementKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

/**
 * Stored form of a ledger debt. Ids are assigned by the ledger (derived from expense and debtor),
 * never generated on insert.
 */
@Entity
@Table(name = "debts", indexes = {
    @Index(name = "idx_debts_household", columnList = "household_id"),
    @Index(name = "idx_debts_expense", columnList = "expense_id")
})
@Getter
@Setter
public class DebtEntry {
  @Id
  private UUID id;

  @ManyToOne(optional = false)
  @JoinColumn(name = "household_id")
  private Household household;

  @Column(name = "expense_id", nullable = false)
  private UUID expenseId;

  @ManyToOne(optional = false)
  @JoinColumn(name = "from_user_id")
  private User fromUser;

  @ManyToOne(optional = false)
  @JoinColumn(name = "to_user_id")
  private User toUser;

  @Column(nullable = false, precision = 19, scale = 2)
  private BigDecimal amount;

  @Column(nullable = false, precision = 19, scale = 2)
  private BigDecimal originalAmount;

  @Column
  private String description;

  @Column(name = "expense_date")
  private LocalDate expenseDate;

  @Column(nullable = false)
  private boolean paid;

  @Column
  private Instant paidAt;

  @Enumerated(EnumType.STRING)
  @Column(length = 16)
  private SettlementKind settledBy;

  @Column(nullable = false)
  private Instant createdAt;
}
