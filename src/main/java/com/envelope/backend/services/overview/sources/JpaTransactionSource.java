package com.envelope.backend.services.overview.sources;

import java.time.LocalDate;
import java.util.List;

import org.springframework.stereotype.Component;

import com.envelope.backend.entities.FinancialTransaction;
import com.envelope.backend.repositories.FinancialTransactionRepository;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class JpaTransactionSource implements TransactionSource {

    private final FinancialTransactionRepository financialTransactionRepository;

    @Override
    public List<FinancialTransaction> listBefore(LocalDate endExclusive) {
        return financialTransactionRepository.findByTransactionDateBefore(endExclusive);
    }
}
