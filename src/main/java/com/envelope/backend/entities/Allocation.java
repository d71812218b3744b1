package com.envelope.backend.entities;

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

/**
 * Money assigned to an envelope for one month. Several rows for the same budget and
 * period add up; a negative amount takes money back out.
 */
@Entity
@Table(
        name = "allocations",
        indexes = {
                @Index(name = "idx_allocation_budget_period", columnList = "budget_id, period"),
                @Index(name = "idx_allocation_period", columnList = "period")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Allocation {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "budget_id", nullable = false)
    private UUID budgetId;

    /** YYYY-MM */
    @Column(nullable = false, length = 7)
    private String period;

    @Column(nullable = false)
    private long amount;

    private String notes;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
}
