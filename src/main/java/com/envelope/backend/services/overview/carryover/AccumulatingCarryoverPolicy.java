package com.envelope.backend.services.overview.carryover;

import java.time.YearMonth;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.envelope.backend.enums.BudgetType;

/**
 * Running ledger: everything allocated minus everything spent before the target month, surplus
 * and deficit alike.
 */
@Component
public class AccumulatingCarryoverPolicy implements CarryoverPolicy {

    @Override
    public Set<BudgetType> budgetTypes() {
        return EnumSet.copyOf(Arrays.stream(BudgetType.values())
                .filter(BudgetType::isAccumulating)
                .toList());
    }

    @Override
    public long carryoverInto(YearMonth target, BudgetHistory history) {
        Optional<YearMonth> first = history.firstPeriod();
        if (first.isEmpty() || !first.get().isBefore(target)) {
            return 0L;
        }
        return history.allocatedBetween(first.get(), target) - history.spentBetween(first.get(), target);
    }
}
