package com.homesplit.repository;

import com.homesplit.model.Household;
import jakarta.persistence.LockModeType;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface HouseholdRepository extends JpaRepository<Household, UUID> {
  Optional<Household> findByInviteCode(String inviteCode);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("select h from Household h where h.id = :id")
  Optional<Household> findByIdForUpdate(@Param("id") UUID id);
}
