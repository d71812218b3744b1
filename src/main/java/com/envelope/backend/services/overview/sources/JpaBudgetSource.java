package com.envelope.backend.services.overview.sources;

import java.util.List;

import org.springframework.stereotype.Component;

import com.envelope.backend.entities.Budget;
import com.envelope.backend.repositories.BudgetRepository;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class JpaBudgetSource implements BudgetSource {

    private final BudgetRepository budgetRepository;

    @Override
    public List<Budget> listActive() {
        return budgetRepository.findByArchivedFalseOrderByNameAsc();
    }
}
