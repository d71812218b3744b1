package com.envelope.backend.enums;

/**
 * Which accounts count towards income and total spending in the monthly overview.
 */
public enum TransactionScope {
    ALL_ACCOUNTS,
    OPERATIONAL_ONLY;

    public boolean includes(AccountRole role) {
        if (this == ALL_ACCOUNTS) {
            return true;
        }
        return role == AccountRole.OPERATIONAL;
    }
}
