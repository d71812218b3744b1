package com.envelope.backend.repositories;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.envelope.backend.entities.Budget;

@Repository
public interface BudgetRepository extends JpaRepository<Budget, UUID> {

    List<Budget> findByArchivedFalseOrderByNameAsc();

    boolean existsByNameIgnoreCaseAndArchivedFalse(String name);

    boolean existsByNameIgnoreCaseAndArchivedFalseAndIdNot(String name, UUID id);
}
