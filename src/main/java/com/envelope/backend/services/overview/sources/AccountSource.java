package com.envelope.backend.services.overview.sources;

import java.util.List;

import com.envelope.backend.entities.Account;
import com.envelope.backend.enums.AccountRole;

public interface AccountSource {

    /**
     * Non-archived accounts, optionally restricted to one role ({@code null} = every role).
     */
    List<Account> listActive(AccountRole role);

    default List<Account> listActive() {
        return listActive(null);
    }
}
