package com.envelope.backend.dto.allocation;

import java.math.BigDecimal;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class AllocationRequest {

    @NotBlank(message = "budgetId is required")
    private String budgetId;

    @NotBlank(message = "period is required")
    private String period;

    /** Major units. Negative takes money back out of the envelope. */
    @NotNull(message = "amount is required")
    private BigDecimal amount;

    @Size(max = 255, message = "notes must be at most 255 characters")
    private String notes;
}
