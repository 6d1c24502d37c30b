package com.remindme.backend.guard.persistence;

import com.remindme.backend.guard.domain.CostLedger;
import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CostLedgerRepository extends JpaRepository<CostLedger, Long> {

  Optional<CostLedger> findByPeriodKey(String periodKey);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("select l from CostLedger l where l.periodKey = :periodKey")
  Optional<CostLedger> findByPeriodKeyForUpdate(@Param("periodKey") String periodKey);

  @Modifying
  @Query(
      value =
          "insert into cost_ledger (period_key, spent, fired_thresholds, exhausted, updated_at)"
              + " values (:periodKey, 0, '', false, :createdAt) on conflict (period_key) do nothing",
      nativeQuery = true)
  int createIfMissing(@Param("periodKey") String periodKey, @Param("createdAt") Instant createdAt);
}
