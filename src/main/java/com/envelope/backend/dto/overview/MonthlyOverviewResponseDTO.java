package com.envelope.backend.dto.overview;

import java.math.BigDecimal;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Monthly overview in display units (major currency units, two decimals).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonthlyOverviewResponseDTO {

    private String period;
    private BigDecimal readyToAssign;
    private BigDecimal totalAllocated;
    private BigDecimal totalSpent;
    private BigDecimal capitalBalance;
    private BigDecimal availableFunds;
    private Double savingsRate;
    private List<BudgetSummaryDTO> budgetSummaries;
}
