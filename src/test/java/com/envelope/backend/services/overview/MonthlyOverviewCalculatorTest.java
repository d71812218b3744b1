package com.envelope.backend.services.overview;

import static com.envelope.backend.services.overview.OverviewFixtures.account;
import static com.envelope.backend.services.overview.OverviewFixtures.allocation;
import static com.envelope.backend.services.overview.OverviewFixtures.budget;
import static com.envelope.backend.services.overview.OverviewFixtures.credit;
import static com.envelope.backend.services.overview.OverviewFixtures.debit;
import static com.envelope.backend.services.overview.OverviewFixtures.tx;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.envelope.backend.config.OverviewProperties;
import com.envelope.backend.entities.Account;
import com.envelope.backend.entities.Budget;
import com.envelope.backend.entities.FinancialTransaction;
import com.envelope.backend.enums.AccountRole;
import com.envelope.backend.enums.BudgetType;
import com.envelope.backend.enums.TransactionScope;
import com.envelope.backend.services.overview.carryover.AccumulatingCarryoverPolicy;
import com.envelope.backend.services.overview.carryover.CarryoverResolver;
import com.envelope.backend.services.overview.carryover.ResettingCarryoverPolicy;

@ExtendWith(MockitoExtension.class)
class MonthlyOverviewCalculatorTest {

    private static final YearMonth MARCH = YearMonth.of(2026, 3);

    @Mock
    private LedgerSnapshotLoader snapshotLoader;

    private MonthlyOverviewCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = calculatorWith(OverviewProperties.defaults());
    }

    private MonthlyOverviewCalculator calculatorWith(OverviewProperties properties) {
        return new MonthlyOverviewCalculator(
                snapshotLoader,
                new FundsAggregator(),
                new PeriodAllocationAggregator(),
                new TransactionAggregator(),
                new CarryoverResolver(List.of(new ResettingCarryoverPolicy(), new AccumulatingCarryoverPolicy())),
                new BudgetEnvelopeBuilder(),
                properties
        );
    }

    @Test
    void readyToAssignIsFundsMinusEverythingAllocated() {
        Budget rent = budget("Rent", BudgetType.SPENDING, MARCH);

        LedgerSnapshot snapshot = new LedgerSnapshot(
                List.of(account(AccountRole.OPERATIONAL, 50_000)),
                List.of(rent),
                List.of(allocation(rent, "2026-03", 30_000)),
                List.of());

        MonthlyOverview overview = calculator.compute(MARCH, snapshot);

        assertEquals(20_000, overview.readyToAssign());
        assertEquals(30_000, overview.totalAllocated());
        assertEquals(50_000, overview.availableFunds());
    }

    @Test
    void overAllocationGivesNegativeReadyToAssign() {
        Budget rent = budget("Rent", BudgetType.SPENDING, MARCH);

        LedgerSnapshot snapshot = new LedgerSnapshot(
                List.of(account(AccountRole.OPERATIONAL, 1_000_000)),
                List.of(rent),
                List.of(allocation(rent, "2026-03", 2_000_000)),
                List.of());

        assertEquals(-1_000_000, calculator.compute(MARCH, snapshot).readyToAssign());
    }

    @Test
    void readyToAssignCountsEarlierMonthsButTotalAllocatedDoesNot() {
        Budget vacation = budget("Vacation", BudgetType.SAVINGS, YearMonth.of(2026, 1));

        LedgerSnapshot snapshot = new LedgerSnapshot(
                List.of(account(AccountRole.OPERATIONAL, 50_000)),
                List.of(vacation),
                List.of(
                        allocation(vacation, "2026-01", 10_000),
                        allocation(vacation, "2026-03", 20_000),
                        allocation(vacation, "2026-04", 15_000)
                ),
                List.of());

        MonthlyOverview overview = calculator.compute(MARCH, snapshot);

        assertEquals(20_000, overview.readyToAssign());
        assertEquals(20_000, overview.totalAllocated());
        BudgetSummary summary = overview.budgetSummaries().get(0);
        assertEquals(10_000, summary.carryover());
        assertEquals(30_000, summary.available());
    }

    @Test
    void spendingEnvelopeSubtractsThisMonthsOutflows() {
        Budget groceries = budget("Groceries", BudgetType.SPENDING, MARCH);

        LedgerSnapshot snapshot = new LedgerSnapshot(
                List.of(account(AccountRole.OPERATIONAL, 600_000)),
                List.of(groceries),
                List.of(allocation(groceries, "2026-03", 500_000)),
                List.of(
                        debit(groceries, LocalDate.of(2026, 3, 3), 25_000),
                        debit(groceries, LocalDate.of(2026, 3, 28), 15_000),
                        debit(groceries, LocalDate.of(2026, 4, 1), 70_000)
                ));

        MonthlyOverview overview = calculator.compute(MARCH, snapshot);

        BudgetSummary summary = overview.budgetSummaries().get(0);
        assertEquals(500_000, summary.allocated());
        assertEquals(40_000, summary.spent());
        assertEquals(0, summary.carryover());
        assertEquals(460_000, summary.available());
        assertEquals(40_000, overview.totalSpent());
    }

    @Test
    void overspendingLastMonthReducesThisMonthsEnvelope() {
        Budget groceries = budget("Groceries", BudgetType.SPENDING, YearMonth.of(2026, 2));

        LedgerSnapshot snapshot = new LedgerSnapshot(
                List.of(account(AccountRole.OPERATIONAL, 100_000)),
                List.of(groceries),
                List.of(
                        allocation(groceries, "2026-02", 3_000),
                        allocation(groceries, "2026-03", 10_000)
                ),
                List.of(debit(groceries, LocalDate.of(2026, 2, 14), 5_000)));

        BudgetSummary summary = calculator.compute(MARCH, snapshot).budgetSummaries().get(0);

        assertEquals(-2_000, summary.carryover());
        assertEquals(8_000, summary.available());
    }

    @Test
    void savingsRateIsZeroWithoutIncome() {
        LedgerSnapshot snapshot = new LedgerSnapshot(
                List.of(account(AccountRole.OPERATIONAL, 10_000)),
                List.of(),
                List.of(),
                List.of(debit(null, LocalDate.of(2026, 3, 5), 4_000)));

        MonthlyOverview overview = calculator.compute(MARCH, snapshot);

        assertEquals(0.0, overview.savingsRate());
        assertEquals(4_000, overview.totalSpent());
    }

    @Test
    void savingsRateIsTheShareOfIncomeNotSpent() {
        LedgerSnapshot snapshot = new LedgerSnapshot(
                List.of(),
                List.of(),
                List.of(),
                List.of(
                        credit(LocalDate.of(2026, 3, 1), 100_000),
                        debit(null, LocalDate.of(2026, 3, 10), 40_000),
                        credit(LocalDate.of(2026, 2, 27), 900_000)
                ));

        assertEquals(0.6, calculator.compute(MARCH, snapshot).savingsRate(), 1e-9);
    }

    @Test
    void savingsRateGoesNegativeWhenSpendingExceedsIncome() {
        assertEquals(-0.5, MonthlyOverviewCalculator.savingsRate(10_000, 15_000), 1e-9);
        assertEquals(0.0, MonthlyOverviewCalculator.savingsRate(0, 15_000));
    }

    @Test
    void archivedBudgetsLeaveTheEnvelopeListButKeepTheirAllocations() {
        Budget rent = budget("Rent", BudgetType.SPENDING, MARCH);
        Budget old = budget("Old gym", BudgetType.SPENDING, MARCH);
        old.setArchived(true);

        LedgerSnapshot snapshot = new LedgerSnapshot(
                List.of(account(AccountRole.OPERATIONAL, 50_000)),
                List.of(rent, old),
                List.of(
                        allocation(rent, "2026-03", 30_000),
                        allocation(old, "2026-03", 10_000)
                ),
                List.of());

        MonthlyOverview overview = calculator.compute(MARCH, snapshot);

        assertEquals(1, overview.budgetSummaries().size());
        assertEquals("Rent", overview.budgetSummaries().get(0).name());
        assertEquals(40_000, overview.totalAllocated());
        assertEquals(10_000, overview.readyToAssign());
    }

    @Test
    void envelopesAreOrderedByName() {
        Budget b = budget("vacation", BudgetType.SAVINGS, MARCH);
        Budget a = budget("Groceries", BudgetType.SPENDING, MARCH);
        Budget c = budget("Car", BudgetType.GOAL, MARCH);

        LedgerSnapshot snapshot = new LedgerSnapshot(List.of(), List.of(b, a, c), List.of(), List.of());

        List<String> names = calculator.compute(MARCH, snapshot).budgetSummaries().stream()
                .map(BudgetSummary::name)
                .toList();

        assertEquals(List.of("Car", "Groceries", "vacation"), names);
    }

    @Test
    void readyToAssignPlusAllocationsAddsUpToFunds() {
        Budget rent = budget("Rent", BudgetType.SPENDING, YearMonth.of(2026, 1));
        Budget vacation = budget("Vacation", BudgetType.SAVINGS, YearMonth.of(2026, 1));

        LedgerSnapshot snapshot = new LedgerSnapshot(
                List.of(
                        account(AccountRole.OPERATIONAL, 120_000),
                        account(AccountRole.OPERATIONAL, 30_000),
                        account(AccountRole.CAPITAL, 1_000_000)
                ),
                List.of(rent, vacation),
                List.of(
                        allocation(rent, "2026-01", 40_000),
                        allocation(rent, "2026-02", 40_000),
                        allocation(vacation, "2026-02", 25_000),
                        allocation(vacation, "2026-03", -5_000)
                ),
                List.of());

        MonthlyOverview overview = calculator.compute(MARCH, snapshot);

        long allocatedEver = 40_000 + 40_000 + 25_000 - 5_000;
        assertEquals(overview.availableFunds(), overview.readyToAssign() + allocatedEver);
        assertEquals(1_000_000, overview.capitalBalance());
        assertEquals(-5_000, overview.totalAllocated());
    }

    @Test
    void sameSnapshotGivesEqualOverviews() {
        Budget groceries = budget("Groceries", BudgetType.SPENDING, YearMonth.of(2026, 1));
        Budget vacation = budget("Vacation", BudgetType.SAVINGS, YearMonth.of(2026, 1));

        LedgerSnapshot snapshot = new LedgerSnapshot(
                List.of(account(AccountRole.OPERATIONAL, 80_000)),
                List.of(groceries, vacation),
                List.of(
                        allocation(groceries, "2026-02", 10_000),
                        allocation(vacation, "2026-03", 5_000)
                ),
                List.of(
                        debit(groceries, LocalDate.of(2026, 2, 3), 12_000),
                        credit(LocalDate.of(2026, 3, 1), 50_000)
                ));

        assertEquals(calculator.compute(MARCH, snapshot), calculator.compute(MARCH, snapshot));
    }

    @Test
    void excludedTransactionsCountNowhere() {
        Budget groceries = budget("Groceries", BudgetType.SPENDING, MARCH);
        FinancialTransaction transfer = debit(groceries, LocalDate.of(2026, 3, 10), 9_000);
        transfer.setExcludedFromCalculations(true);
        FinancialTransaction refund = credit(LocalDate.of(2026, 3, 11), 9_000);
        refund.setExcludedFromCalculations(true);

        LedgerSnapshot snapshot = new LedgerSnapshot(
                List.of(),
                List.of(groceries),
                List.of(allocation(groceries, "2026-03", 10_000)),
                List.of(transfer, refund, debit(groceries, LocalDate.of(2026, 3, 12), 1_000)));

        MonthlyOverview overview = calculator.compute(MARCH, snapshot);

        assertEquals(1_000, overview.totalSpent());
        assertEquals(0.0, overview.savingsRate());
        assertEquals(1_000, overview.budgetSummaries().get(0).spent());
    }

    @Test
    void operationalOnlyScopeIgnoresCapitalAccountsInTotals() {
        Account checking = account(AccountRole.OPERATIONAL, 10_000);
        Account brokerage = account(AccountRole.CAPITAL, 500_000);
        Budget groceries = budget("Groceries", BudgetType.SPENDING, MARCH);

        LedgerSnapshot snapshot = new LedgerSnapshot(
                List.of(checking, brokerage),
                List.of(groceries),
                List.of(),
                List.of(
                        tx(checking.getId(), groceries.getId(), LocalDate.of(2026, 3, 2), -3_000),
                        tx(brokerage.getId(), groceries.getId(), LocalDate.of(2026, 3, 2), -7_000),
                        tx(brokerage.getId(), null, LocalDate.of(2026, 3, 5), 20_000),
                        tx(checking.getId(), null, LocalDate.of(2026, 3, 5), 10_000)
                ));

        MonthlyOverview all = calculator.compute(MARCH, snapshot);
        MonthlyOverview operational = calculatorWith(new OverviewProperties(TransactionScope.OPERATIONAL_ONLY, null))
                .compute(MARCH, snapshot);

        assertEquals(10_000, all.totalSpent());
        assertEquals(3_000, operational.totalSpent());
        assertEquals(0.7, operational.savingsRate(), 1e-9);
        assertEquals(10_000, operational.budgetSummaries().get(0).spent());
    }

    @Test
    void computeMonthlyOverviewLoadsTheSnapshotForThePeriod() {
        Budget rent = budget("Rent", BudgetType.SPENDING, MARCH);
        LedgerSnapshot snapshot = new LedgerSnapshot(
                List.of(account(AccountRole.OPERATIONAL, 50_000)),
                List.of(rent),
                List.of(allocation(rent, "2026-03", 30_000)),
                List.of());
        when(snapshotLoader.load(MARCH)).thenReturn(snapshot);

        MonthlyOverview overview = calculator.computeMonthlyOverview(MARCH);

        verify(snapshotLoader).load(MARCH);
        assertEquals(MARCH, overview.period());
        assertEquals(20_000, overview.readyToAssign());
    }

    @Test
    void readFailuresPropagateUnchanged() {
        IllegalStateException failure = new IllegalStateException("accounts unavailable");
        when(snapshotLoader.load(MARCH)).thenThrow(failure);

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> calculator.computeMonthlyOverview(MARCH));

        assertSame(failure, thrown);
    }

    @Test
    void emptyLedgerIsAllZeros() {
        MonthlyOverview overview = calculator.compute(MARCH, new LedgerSnapshot(null, null, null, null));

        assertEquals(0, overview.readyToAssign());
        assertEquals(0, overview.totalAllocated());
        assertEquals(0, overview.totalSpent());
        assertEquals(0.0, overview.savingsRate());
        assertTrue(overview.budgetSummaries().isEmpty());
    }
}
