package com.homesplit.repository;

import com.homesplit.model.RecurringExpense;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RecurringExpenseRepository extends JpaRepository<RecurringExpense, UUID> {
  @Query("select r from RecurringExpense r where r.household.id = :householdId order by r.startDate")
  List<RecurringExpense> findByHouseholdId(@Param("householdId") UUID householdId);

  @Query("select distinct r.household.id from RecurringExpense r")
  List<UUID> findHouseholdIdsWithTemplates();
}
