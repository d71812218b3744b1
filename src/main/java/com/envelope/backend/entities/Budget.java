package com.envelope.backend.entities;

import java.time.LocalDateTime;
import java.util.UUID;

import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import com.envelope.backend.enums.BudgetType;
import com.envelope.backend.enums.TargetCadence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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
 * An envelope: a named bucket of money with a type-specific rollover policy.
 */
@Entity
@Table(
        name = "budgets",
        indexes = {
                @Index(name = "idx_budget_archived", columnList = "archived")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Budget {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "budget_type", nullable = false, length = 20)
    @Builder.Default
    private BudgetType type = BudgetType.SPENDING;

    @Column(name = "target_amount", nullable = false)
    private long targetAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "target_cadence", length = 20)
    private TargetCadence targetCadence;

    /** Only meaningful for {@link TargetCadence#CUSTOM}. */
    @Column(name = "target_cadence_months")
    private Integer targetCadenceMonths;

    @Column(nullable = false)
    private boolean archived;

    // Also the first period the carryover walk looks at
    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
