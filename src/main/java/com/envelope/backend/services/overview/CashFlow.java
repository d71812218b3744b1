package com.envelope.backend.services.overview;

/**
 * Money in and money out over a date range, both as non-negative minor units.
 */
public record CashFlow(long inflow, long outflow) {

    public static final CashFlow EMPTY = new CashFlow(0L, 0L);

    public long net() {
        return inflow - outflow;
    }
}
