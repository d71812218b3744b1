package com.envelope.backend.services.overview.carryover;

import java.time.YearMonth;
import java.util.Set;

import com.envelope.backend.enums.BudgetType;

/**
 * How an envelope's balance rolls from earlier months into a target month.
 */
public interface CarryoverPolicy {

    Set<BudgetType> budgetTypes();

    /**
     * Balance carried into {@code target}, built only from months strictly before it and not
     * before the envelope's first period.
     */
    long carryoverInto(YearMonth target, BudgetHistory history);
}
