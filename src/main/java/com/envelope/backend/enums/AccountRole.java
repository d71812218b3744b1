package com.envelope.backend.enums;

public enum AccountRole {
    /** Spendable cash. Feeds "available funds" and "ready to assign". */
    OPERATIONAL,
    /** Savings and investments, kept out of day-to-day spending power. */
    CAPITAL
}
