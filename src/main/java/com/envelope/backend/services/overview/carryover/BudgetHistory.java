package com.envelope.backend.services.overview.carryover;

import java.time.YearMonth;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

import com.envelope.backend.entities.Allocation;
import com.envelope.backend.entities.Budget;
import com.envelope.backend.entities.FinancialTransaction;
import com.envelope.backend.services.overview.PeriodAllocationAggregator;
import com.envelope.backend.services.overview.Periods;
import com.envelope.backend.services.overview.TransactionAggregator;

/**
 * One envelope's allocations and linked transactions, answering per-month questions for the
 * carryover policies.
 */
public class BudgetHistory {

    private final Budget budget;
    private final List<Allocation> allocations;
    private final List<FinancialTransaction> transactions;
    private final PeriodAllocationAggregator allocationAggregator;
    private final TransactionAggregator transactionAggregator;

    public BudgetHistory(
            Budget budget,
            List<Allocation> allocations,
            List<FinancialTransaction> transactions,
            PeriodAllocationAggregator allocationAggregator,
            TransactionAggregator transactionAggregator
    ) {
        this.budget = Objects.requireNonNull(budget, "budget");
        this.allocations = allocations != null ? List.copyOf(allocations) : List.of();
        this.transactions = transactions != null ? List.copyOf(transactions) : List.of();
        this.allocationAggregator = allocationAggregator;
        this.transactionAggregator = transactionAggregator;
    }

    public Budget getBudget() {
        return budget;
    }

    /**
     * The earliest month the envelope can carry anything from: the month it was created. Budgets
     * without a creation timestamp fall back to their earliest allocation or dated transaction.
     */
    public Optional<YearMonth> firstPeriod() {
        if (budget.getCreatedAt() != null) {
            return Optional.of(YearMonth.from(budget.getCreatedAt()));
        }

        Stream<YearMonth> allocationPeriods = allocations.stream()
                .map(Allocation::getPeriod)
                .filter(Objects::nonNull)
                .map(Periods::parse);
        Stream<YearMonth> transactionPeriods = transactions.stream()
                .filter(tx -> !tx.isExcludedFromCalculations())
                .map(FinancialTransaction::getTransactionDate)
                .filter(Objects::nonNull)
                .map(YearMonth::from);

        return Stream.concat(allocationPeriods, transactionPeriods).min(YearMonth::compareTo);
    }

    public long allocatedIn(YearMonth period) {
        return allocationAggregator.sumForPeriod(allocations, budget.getId(), period);
    }

    public long spentIn(YearMonth period) {
        return spentBetween(period, period.plusMonths(1));
    }

    public long allocatedBetween(YearMonth fromInclusive, YearMonth toExclusive) {
        return allocationAggregator.sumBetween(allocations, budget.getId(), fromInclusive, toExclusive);
    }

    public long spentBetween(YearMonth fromInclusive, YearMonth toExclusive) {
        return transactionAggregator
                .sumInRange(transactions, budget.getId(), Periods.start(fromInclusive), Periods.start(toExclusive))
                .outflow();
    }
}
