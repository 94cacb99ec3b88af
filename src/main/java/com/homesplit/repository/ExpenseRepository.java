package com.homesplit.repository;

import com.homesplit.model.Expense;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ExpenseRepository extends JpaRepository<Expense, UUID> {
  @Query("select e from Expense e " +
      "where e.household.id = :householdId " +
      "and e.expenseDate >= :from and e.expenseDate <= :to " +
      "order by e.expenseDate, e.createdAt")
  List<Expense> findHouseholdExpensesInRange(
      @Param("householdId") UUID householdId,
      @Param("from") LocalDate from,
      @Param("to") LocalDate to);

  @Query("select e.category, sum(e.amount), count(e) from Expense e " +
      "where e.household.id = :householdId " +
      "and e.expenseDate >= :from and e.expenseDate <= :to " +
      "group by e.category order by sum(e.amount) desc, e.category")
  List<Object[]> sumByCategory(
      @Param("householdId") UUID householdId,
      @Param("from") LocalDate from,
      @Param("to") LocalDate to);

  @Query("select e.paidBy.id, sum(e.amount), count(e) from Expense e " +
      "where e.household.id = :householdId " +
      "and e.expenseDate >= :from and e.expenseDate <= :to " +
      "group by e.paidBy.id order by sum(e.amount) desc")
  List<Object[]> sumByPayer(
      @Param("householdId") UUID householdId,
      @Param("from") LocalDate from,
      @Param("to") LocalDate to);

  @Query("select year(e.expenseDate), month(e.expenseDate), sum(e.amount), count(e) from Expense e " +
      "where e.household.id = :householdId " +
      "and e.expenseDate >= :from and e.expenseDate <= :to " +
      "group by year(e.expenseDate), month(e.expenseDate) " +
      "order by year(e.expenseDate), month(e.expenseDate)")
  List<Object[]> sumByMonth(
      @Param("householdId") UUID householdId,
      @Param("from") LocalDate from,
      @Param("to") LocalDate to);

  @Query("select e.id from Expense e where e.household.id = :householdId")
  List<UUID> findIdsByHouseholdId(@Param("householdId") UUID householdId);

  @Query("select e.instanceKey from Expense e where e.instanceKey in :keys")
  List<String> findExistingInstanceKeys(@Param("keys") Collection<String> keys);

  @Modifying
  @Query("update Expense e set e.recurringExpense = null where e.recurringExpense.id = :recurringExpenseId")
  int detachFromRecurringExpense(@Param("recurringExpenseId") UUID recurringExpenseId);
}
