package com.envelope.backend.services.overview.sources;

import java.util.List;

import com.envelope.backend.entities.Budget;

public interface BudgetSource {

    /** Non-archived budgets. */
    List<Budget> listActive();
}
