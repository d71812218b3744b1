package com.envelope.backend.services.overview;

import java.util.Collection;
import java.util.Objects;

import org.springframework.stereotype.Component;

import com.envelope.backend.entities.Account;
import com.envelope.backend.enums.AccountRole;

@Component
public class FundsAggregator {

    public long availableFunds(Collection<Account> accounts) {
        return sumByRole(accounts, AccountRole.OPERATIONAL);
    }

    public long capitalBalance(Collection<Account> accounts) {
        return sumByRole(accounts, AccountRole.CAPITAL);
    }

    public long sumByRole(Collection<Account> accounts, AccountRole role) {
        if (accounts == null || accounts.isEmpty()) {
            return 0L;
        }
        return accounts.stream()
                .filter(Objects::nonNull)
                .filter(account -> !account.isArchived())
                .filter(account -> account.getRole() == role)
                .mapToLong(Account::getBalance)
                .sum();
    }
}
