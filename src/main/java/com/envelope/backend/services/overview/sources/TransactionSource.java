package com.envelope.backend.services.overview.sources;

import java.time.LocalDate;
import java.util.List;

import com.envelope.backend.entities.FinancialTransaction;

public interface TransactionSource {

    /** Dated transactions strictly before {@code endExclusive}. */
    List<FinancialTransaction> listBefore(LocalDate endExclusive);
}
