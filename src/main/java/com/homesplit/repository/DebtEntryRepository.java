package com.homesplit.repository;

import com.homesplit.model.DebtEntry;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface DebtEntryRepository extends JpaRepository<DebtEntry, UUID> {
  @Query("select d from DebtEntry d where d.household.id = :householdId order by d.expenseDate, d.createdAt")
  List<DebtEntry> findByHouseholdId(@Param("householdId") UUID householdId);
}
