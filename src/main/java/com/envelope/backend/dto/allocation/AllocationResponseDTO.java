package com.envelope.backend.dto.allocation;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record AllocationResponseDTO(
        String id,
        String budgetId,
        String period,
        BigDecimal amount,
        String notes,
        LocalDateTime createdAt
) {
}
