package com.envelope.backend.entities;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

import org.hibernate.annotations.CreationTimestamp;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(
        name = "financial_transactions",
        indexes = {
                @Index(name = "idx_tx_date", columnList = "transaction_date"),
                @Index(name = "idx_tx_budget_date", columnList = "budget_id, transaction_date")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FinancialTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "account_id", nullable = false)
    private UUID accountId;

    /** Null while the transaction is not assigned to any envelope. */
    @Column(name = "budget_id")
    private UUID budgetId;

    private String description;

    @Column(name = "transaction_date")
    private LocalDate transactionDate;

    // Minor units: negative = outflow (debit), positive = inflow (credit)
    @Column(nullable = false)
    private long amount;

    /** Internal transfers and similar movements that must not count as income or spending. */
    @Column(name = "excluded_from_calculations", nullable = false)
    private boolean excludedFromCalculations;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
}
