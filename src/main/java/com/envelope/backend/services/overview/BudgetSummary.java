package com.envelope.backend.services.overview;

import java.util.UUID;

import com.envelope.backend.enums.BudgetType;

/**
 * One envelope in the monthly overview. Amounts are minor units and
 * {@code available == allocated + carryover - spent} always holds.
 */
public record BudgetSummary(
        UUID budgetId,
        String name,
        BudgetType type,
        long targetAmount,
        long allocated,
        long spent,
        long carryover,
        long available
) {
}
