package com.envelope.backend.repositories;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.envelope.backend.entities.Account;
import com.envelope.backend.enums.AccountRole;

@Repository
public interface AccountRepository extends JpaRepository<Account, UUID> {

    List<Account> findByArchivedFalse();

    List<Account> findByArchivedFalseAndRole(AccountRole role);
}
