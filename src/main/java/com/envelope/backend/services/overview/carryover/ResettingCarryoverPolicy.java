package com.envelope.backend.services.overview.carryover;

import java.time.YearMonth;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.envelope.backend.enums.BudgetType;

/**
 * Use-it-or-lose-it: a surplus resets to zero at every month boundary, while overspending keeps
 * accumulating until a later allocation absorbs it.
 */
@Component
public class ResettingCarryoverPolicy implements CarryoverPolicy {

    @Override
    public Set<BudgetType> budgetTypes() {
        return EnumSet.copyOf(Arrays.stream(BudgetType.values())
                .filter(type -> !type.isAccumulating())
                .toList());
    }

    @Override
    public long carryoverInto(YearMonth target, BudgetHistory history) {
        Optional<YearMonth> first = history.firstPeriod();
        if (first.isEmpty()) {
            return 0L;
        }

        long running = 0L;
        for (YearMonth month = first.get(); month.isBefore(target); month = month.plusMonths(1)) {
            running = Math.min(0L, running + history.allocatedIn(month) - history.spentIn(month));
        }
        return running;
    }
}
