package com.envelope.backend.services.overview;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Objects;
import java.util.UUID;

import org.springframework.stereotype.Component;

import com.envelope.backend.entities.FinancialTransaction;

@Component
public class TransactionAggregator {

    /**
     * Splits the transactions dated in {@code [from, toExclusive)} into inflow (positive amounts) and
     * outflow (absolute value of negative amounts). Undated and excluded transactions never count.
     *
     * @param budgetId restricts the sum to one envelope; {@code null} takes every transaction,
     *                 linked or not
     */
    public CashFlow sumInRange(Collection<FinancialTransaction> transactions, UUID budgetId,
                               LocalDate from, LocalDate toExclusive) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(toExclusive, "toExclusive");
        if (transactions == null || transactions.isEmpty()) {
            return CashFlow.EMPTY;
        }

        long inflow = 0L;
        long outflow = 0L;

        for (FinancialTransaction tx : transactions) {
            if (tx == null || tx.isExcludedFromCalculations()) {
                continue;
            }
            if (budgetId != null && !budgetId.equals(tx.getBudgetId())) {
                continue;
            }
            if (!isWithin(tx.getTransactionDate(), from, toExclusive)) {
                continue;
            }

            long amount = tx.getAmount();
            if (amount > 0) {
                inflow += amount;
            } else if (amount < 0) {
                outflow += -amount;
            }
        }

        return new CashFlow(inflow, outflow);
    }

    private static boolean isWithin(LocalDate date, LocalDate from, LocalDate toExclusive) {
        return date != null && !date.isBefore(from) && date.isBefore(toExclusive);
    }
}
