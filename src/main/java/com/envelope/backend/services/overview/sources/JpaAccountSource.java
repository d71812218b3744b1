package com.envelope.backend.services.overview.sources;

import java.util.List;

import org.springframework.stereotype.Component;

import com.envelope.backend.entities.Account;
import com.envelope.backend.enums.AccountRole;
import com.envelope.backend.repositories.AccountRepository;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class JpaAccountSource implements AccountSource {

    private final AccountRepository accountRepository;

    @Override
    public List<Account> listActive(AccountRole role) {
        if (role == null) {
            return accountRepository.findByArchivedFalse();
        }
        return accountRepository.findByArchivedFalseAndRole(role);
    }
}
