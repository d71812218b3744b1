package com.envelope.backend.enums;

public enum BudgetType {
    SPENDING,
    SAVINGS,
    GOAL,
    PERIODIC;

    /**
     * Envelopes that behave like a running ledger: leftovers and deficits both roll forward.
     */
    public boolean isAccumulating() {
        return this != SPENDING;
    }
}
