package com.envelope.backend.dto.budget;

import java.math.BigDecimal;

import com.envelope.backend.enums.BudgetType;
import com.envelope.backend.enums.TargetCadence;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class BudgetRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 255, message = "Name must be at most 255 characters")
    private String name;

    // Defaults to SPENDING
    private BudgetType type;

    @NotNull(message = "Target amount is required")
    @PositiveOrZero(message = "Target amount cannot be negative")
    private BigDecimal targetAmount;

    private TargetCadence targetCadence;

    @Positive(message = "Cadence months must be positive")
    private Integer targetCadenceMonths;
}
