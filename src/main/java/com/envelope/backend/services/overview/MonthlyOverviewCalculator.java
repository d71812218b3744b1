package com.envelope.backend.services.overview;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.envelope.backend.config.OverviewProperties;
import com.envelope.backend.entities.Account;
import com.envelope.backend.entities.Allocation;
import com.envelope.backend.entities.Budget;
import com.envelope.backend.entities.FinancialTransaction;
import com.envelope.backend.enums.AccountRole;
import com.envelope.backend.enums.TransactionScope;
import com.envelope.backend.services.overview.carryover.BudgetHistory;
import com.envelope.backend.services.overview.carryover.CarryoverResolver;

import lombok.RequiredArgsConstructor;

/**
 * Builds the monthly overview: unassigned funds, envelope balances, spending and savings rate.
 *
 * <p>Stateless and free of side effects. Apart from the initial snapshot read, everything is
 * computed in memory, so the same data always yields an equal result.
 */
@Service
@RequiredArgsConstructor
public class MonthlyOverviewCalculator {

    private static final Logger logger = LoggerFactory.getLogger(MonthlyOverviewCalculator.class);

    private static final Comparator<Budget> BY_NAME = Comparator
            .comparing(Budget::getName, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER))
            .thenComparing(Budget::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final LedgerSnapshotLoader snapshotLoader;
    private final FundsAggregator fundsAggregator;
    private final PeriodAllocationAggregator allocationAggregator;
    private final TransactionAggregator transactionAggregator;
    private final CarryoverResolver carryoverResolver;
    private final BudgetEnvelopeBuilder envelopeBuilder;
    private final OverviewProperties properties;

    public MonthlyOverview computeMonthlyOverview(YearMonth period) {
        Objects.requireNonNull(period, "period");
        logger.info("[Overview] computeMonthlyOverview started for {}", period);

        LedgerSnapshot snapshot = snapshotLoader.load(period);
        MonthlyOverview overview = compute(period, snapshot);

        logger.info("[Overview] computeMonthlyOverview finished for {}: {} envelopes, readyToAssign={}",
                period, overview.budgetSummaries().size(), overview.readyToAssign());
        return overview;
    }

    public MonthlyOverview compute(YearMonth period, LedgerSnapshot snapshot) {
        LocalDate from = Periods.start(period);
        LocalDate to = Periods.endExclusive(period);

        // ================== FUNDS ==================

        long availableFunds = fundsAggregator.availableFunds(snapshot.accounts());
        long capitalBalance = fundsAggregator.capitalBalance(snapshot.accounts());

        // ================== ALLOCATIONS ==================

        List<Budget> activeBudgets = snapshot.budgets().stream()
                .filter(Objects::nonNull)
                .filter(budget -> !budget.isArchived())
                .sorted(BY_NAME)
                .toList();
        Set<UUID> activeBudgetIds = activeBudgets.stream()
                .map(Budget::getId)
                .collect(Collectors.toSet());

        List<Allocation> activeAllocations = snapshot.allocations().stream()
                .filter(allocation -> activeBudgetIds.contains(allocation.getBudgetId()))
                .toList();

        // Money assigned to an envelope stays assigned after the envelope is archived.
        long totalAllocated = allocationAggregator.sumForPeriod(snapshot.allocations(), null, period);
        long allocatedEver = allocationAggregator.sumCumulative(snapshot.allocations(), null, period);
        long readyToAssign = availableFunds - allocatedEver;

        // ================== CASH FLOW ==================

        CashFlow cashFlow = transactionAggregator.sumInRange(inScope(snapshot), null, from, to);
        long totalSpent = cashFlow.outflow();
        double savingsRate = savingsRate(cashFlow.inflow(), totalSpent);

        logger.debug("[Overview] {}: availableFunds={}, allocatedEver={}, totalAllocated={}, income={}, totalSpent={}, net={}",
                period, availableFunds, allocatedEver, totalAllocated, cashFlow.inflow(), totalSpent, cashFlow.net());

        // ================== ENVELOPES ==================

        Map<UUID, List<Allocation>> allocationsByBudget = activeAllocations.stream()
                .collect(Collectors.groupingBy(Allocation::getBudgetId));
        Map<UUID, List<FinancialTransaction>> transactionsByBudget = snapshot.transactions().stream()
                .filter(tx -> tx.getBudgetId() != null && activeBudgetIds.contains(tx.getBudgetId()))
                .collect(Collectors.groupingBy(FinancialTransaction::getBudgetId));

        List<BudgetSummary> budgetSummaries = activeBudgets.stream()
                .map(budget -> summarize(
                        period,
                        new BudgetHistory(
                                budget,
                                allocationsByBudget.getOrDefault(budget.getId(), List.of()),
                                transactionsByBudget.getOrDefault(budget.getId(), List.of()),
                                allocationAggregator,
                                transactionAggregator
                        )))
                .toList();

        return MonthlyOverview.builder()
                .period(period)
                .readyToAssign(readyToAssign)
                .totalAllocated(totalAllocated)
                .totalSpent(totalSpent)
                .capitalBalance(capitalBalance)
                .availableFunds(availableFunds)
                .savingsRate(savingsRate)
                .budgetSummaries(budgetSummaries)
                .build();
    }

    private BudgetSummary summarize(YearMonth period, BudgetHistory history) {
        long allocated = history.allocatedIn(period);
        long spent = history.spentIn(period);
        long carryover = carryoverResolver.resolve(history, period);
        return envelopeBuilder.build(history.getBudget(), allocated, carryover, spent);
    }

    private List<FinancialTransaction> inScope(LedgerSnapshot snapshot) {
        TransactionScope scope = properties.transactionScope();
        if (scope == TransactionScope.ALL_ACCOUNTS) {
            return snapshot.transactions();
        }

        // Transactions of archived or unknown accounts have no role and fall out of scope.
        Map<UUID, AccountRole> roleByAccount = snapshot.accounts().stream()
                .filter(account -> !account.isArchived() && account.getRole() != null)
                .collect(Collectors.toMap(Account::getId, Account::getRole, (a, b) -> a));

        return snapshot.transactions().stream()
                .filter(tx -> scope.includes(roleByAccount.get(tx.getAccountId())))
                .toList();
    }

    static double savingsRate(long income, long expense) {
        if (income == 0L) {
            return 0.0;
        }
        return (double) (income - expense) / (double) income;
    }
}
