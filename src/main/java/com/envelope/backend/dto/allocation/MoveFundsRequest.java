package com.envelope.backend.dto.allocation;

import java.math.BigDecimal;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class MoveFundsRequest {

    @NotBlank(message = "sourceBudgetId is required")
    private String sourceBudgetId;

    @NotBlank(message = "destBudgetId is required")
    private String destBudgetId;

    @NotBlank(message = "period is required")
    private String period;

    @NotNull(message = "amount is required")
    @Positive(message = "amount must be positive")
    private BigDecimal amount;

    @Size(max = 255, message = "notes must be at most 255 characters")
    private String notes;
}
