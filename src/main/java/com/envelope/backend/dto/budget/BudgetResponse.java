package com.envelope.backend.dto.budget;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

import com.envelope.backend.enums.BudgetType;
import com.envelope.backend.enums.TargetCadence;

import lombok.Data;

@Data
public class BudgetResponse {

    private UUID id;
    private String name;
    private BudgetType type;
    private BigDecimal targetAmount;
    private TargetCadence targetCadence;
    private Integer targetCadenceMonths;
    private boolean archived;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
