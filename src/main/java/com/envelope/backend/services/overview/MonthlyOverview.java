package com.envelope.backend.services.overview;

import java.time.YearMonth;
import java.util.List;

import lombok.Builder;

/**
 * Financial snapshot of one month. Every amount is in minor units; {@code savingsRate} is a plain
 * ratio (0.25 = a quarter of the income was kept).
 */
@Builder
public record MonthlyOverview(
        YearMonth period,
        long readyToAssign,
        long totalAllocated,
        long totalSpent,
        long capitalBalance,
        long availableFunds,
        double savingsRate,
        List<BudgetSummary> budgetSummaries
) {
    public MonthlyOverview {
        budgetSummaries = budgetSummaries != null ? List.copyOf(budgetSummaries) : List.of();
    }
}
