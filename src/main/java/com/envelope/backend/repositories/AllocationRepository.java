package com.envelope.backend.repositories;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.envelope.backend.entities.Allocation;

@Repository
public interface AllocationRepository extends JpaRepository<Allocation, UUID> {

    // Periods are zero-padded YYYY-MM, so string order is chronological order.
    List<Allocation> findByPeriodLessThanEqual(String period);

    List<Allocation> findAllByOrderByPeriodAscCreatedAtAsc();

    List<Allocation> findByBudgetIdOrderByPeriodAscCreatedAtAsc(UUID budgetId);

    List<Allocation> findByPeriodOrderByCreatedAtAsc(String period);

    List<Allocation> findByBudgetIdAndPeriodOrderByCreatedAtAsc(UUID budgetId, String period);
}
