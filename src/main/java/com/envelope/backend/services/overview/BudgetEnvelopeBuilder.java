package com.envelope.backend.services.overview;

import org.springframework.stereotype.Component;

import com.envelope.backend.entities.Budget;

@Component
public class BudgetEnvelopeBuilder {

    /**
     * {@code available = allocated + carryover - spent}, never clamped: a negative result is an
     * overspent envelope, which is a valid state.
     */
    public BudgetSummary build(Budget budget, long allocated, long carryover, long spent) {
        return new BudgetSummary(
                budget.getId(),
                budget.getName(),
                budget.getType(),
                budget.getTargetAmount(),
                allocated,
                spent,
                carryover,
                allocated + carryover - spent
        );
    }
}
