package com.envelope.backend.services.overview;

import java.time.YearMonth;
import java.util.Collection;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Predicate;

import org.springframework.stereotype.Component;

import com.envelope.backend.entities.Allocation;

/**
 * Sums allocation amounts. A {@code null} budget id means "every budget in the collection".
 *
 * <p>{@link #sumForPeriod} and {@link #sumCumulative} answer different questions ("assigned this
 * month" vs. "assigned ever, up to this month") and must not be swapped for one another.
 */
@Component
public class PeriodAllocationAggregator {

    /**
     * Allocations whose period equals {@code period} exactly.
     */
    public long sumForPeriod(Collection<Allocation> allocations, UUID budgetId, YearMonth period) {
        return sum(allocations, budgetId, p -> p.equals(period));
    }

    /**
     * Allocations in every period up to and including {@code throughPeriod}.
     */
    public long sumCumulative(Collection<Allocation> allocations, UUID budgetId, YearMonth throughPeriod) {
        return sum(allocations, budgetId, p -> !p.isAfter(throughPeriod));
    }

    /**
     * Allocations in {@code [fromInclusive, toExclusive)}.
     */
    public long sumBetween(Collection<Allocation> allocations, UUID budgetId,
                           YearMonth fromInclusive, YearMonth toExclusive) {
        return sum(allocations, budgetId, p -> !p.isBefore(fromInclusive) && p.isBefore(toExclusive));
    }

    private long sum(Collection<Allocation> allocations, UUID budgetId, Predicate<YearMonth> periodFilter) {
        if (allocations == null || allocations.isEmpty()) {
            return 0L;
        }
        return allocations.stream()
                .filter(Objects::nonNull)
                .filter(allocation -> budgetId == null || budgetId.equals(allocation.getBudgetId()))
                .filter(allocation -> allocation.getPeriod() != null)
                .filter(allocation -> periodFilter.test(Periods.parse(allocation.getPeriod())))
                .mapToLong(Allocation::getAmount)
                .sum();
    }
}
