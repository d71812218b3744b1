package com.envelope.backend.services.overview;

import java.util.List;

import com.envelope.backend.entities.Account;
import com.envelope.backend.entities.Allocation;
import com.envelope.backend.entities.Budget;
import com.envelope.backend.entities.FinancialTransaction;

/**
 * The four input feeds of one overview computation, read once and never refreshed mid-run.
 */
public record LedgerSnapshot(
        List<Account> accounts,
        List<Budget> budgets,
        List<Allocation> allocations,
        List<FinancialTransaction> transactions
) {
    public LedgerSnapshot {
        accounts = accounts != null ? List.copyOf(accounts) : List.of();
        budgets = budgets != null ? List.copyOf(budgets) : List.of();
        allocations = allocations != null ? List.copyOf(allocations) : List.of();
        transactions = transactions != null ? List.copyOf(transactions) : List.of();
    }
}
