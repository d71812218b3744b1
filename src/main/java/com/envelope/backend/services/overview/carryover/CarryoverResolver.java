package com.envelope.backend.services.overview.carryover;

import java.time.YearMonth;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.envelope.backend.enums.BudgetType;

/**
 * Dispatches the carryover computation to the policy registered for the envelope's type.
 */
@Component
public class CarryoverResolver {

    private final Map<BudgetType, CarryoverPolicy> policies;

    public CarryoverResolver(List<CarryoverPolicy> policies) {
        Map<BudgetType, CarryoverPolicy> byType = new EnumMap<>(BudgetType.class);
        for (CarryoverPolicy policy : policies) {
            for (BudgetType type : policy.budgetTypes()) {
                CarryoverPolicy previous = byType.putIfAbsent(type, policy);
                if (previous != null) {
                    throw new IllegalStateException("Budget type " + type + " has two carryover policies: "
                            + previous.getClass().getSimpleName() + " and " + policy.getClass().getSimpleName());
                }
            }
        }
        for (BudgetType type : BudgetType.values()) {
            if (!byType.containsKey(type)) {
                throw new IllegalStateException("No carryover policy registered for budget type " + type);
            }
        }
        this.policies = Collections.unmodifiableMap(byType);
    }

    public long resolve(BudgetHistory history, YearMonth target) {
        return policyFor(history.getBudget().getType()).carryoverInto(target, history);
    }

    public CarryoverPolicy policyFor(BudgetType type) {
        return policies.get(type != null ? type : BudgetType.SPENDING);
    }
}
