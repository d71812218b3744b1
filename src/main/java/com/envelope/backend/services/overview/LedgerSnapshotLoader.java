package com.envelope.backend.services.overview;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import com.envelope.backend.config.AsyncExecutorConfig;
import com.envelope.backend.entities.Account;
import com.envelope.backend.entities.Allocation;
import com.envelope.backend.entities.Budget;
import com.envelope.backend.entities.FinancialTransaction;
import com.envelope.backend.services.overview.sources.AccountSource;
import com.envelope.backend.services.overview.sources.AllocationSource;
import com.envelope.backend.services.overview.sources.BudgetSource;
import com.envelope.backend.services.overview.sources.TransactionSource;

import lombok.extern.slf4j.Slf4j;

/**
 * Reads the four ledger feeds concurrently and waits for all of them. A failing read is rethrown
 * as-is; nothing is retried.
 */
@Slf4j
@Component
public class LedgerSnapshotLoader {

    private final AccountSource accountSource;
    private final BudgetSource budgetSource;
    private final AllocationSource allocationSource;
    private final TransactionSource transactionSource;
    private final Executor executor;

    public LedgerSnapshotLoader(
            AccountSource accountSource,
            BudgetSource budgetSource,
            AllocationSource allocationSource,
            TransactionSource transactionSource,
            @Qualifier(AsyncExecutorConfig.OVERVIEW_EXECUTOR) Executor executor
    ) {
        this.accountSource = accountSource;
        this.budgetSource = budgetSource;
        this.allocationSource = allocationSource;
        this.transactionSource = transactionSource;
        this.executor = executor;
    }

    public LedgerSnapshot load(YearMonth period) {
        LocalDate endExclusive = Periods.endExclusive(period);

        CompletableFuture<List<Account>> accounts =
                CompletableFuture.supplyAsync(accountSource::listActive, executor);
        CompletableFuture<List<Budget>> budgets =
                CompletableFuture.supplyAsync(budgetSource::listActive, executor);
        CompletableFuture<List<Allocation>> allocations =
                CompletableFuture.supplyAsync(() -> allocationSource.listThrough(period), executor);
        CompletableFuture<List<FinancialTransaction>> transactions =
                CompletableFuture.supplyAsync(() -> transactionSource.listBefore(endExclusive), executor);

        try {
            CompletableFuture.allOf(accounts, budgets, allocations, transactions).join();
        } catch (CompletionException e) {
            log.warn("[Overview] Ledger read failed for {}: {}", period, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            throw unwrap(e);
        }

        LedgerSnapshot snapshot = new LedgerSnapshot(
                accounts.join(),
                budgets.join(),
                allocations.join(),
                transactions.join()
        );
        log.debug("[Overview] Snapshot for {}: {} accounts, {} budgets, {} allocations, {} transactions",
                period,
                snapshot.accounts().size(),
                snapshot.budgets().size(),
                snapshot.allocations().size(),
                snapshot.transactions().size());
        return snapshot;
    }

    private static RuntimeException unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return e;
    }
}
