package com.envelope.backend.dto.overview;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BudgetSummaryDTO {

    private String budgetId;
    private String name;
    private String type;
    private BigDecimal targetAmount;
    private BigDecimal allocated;
    private BigDecimal spent;
    private BigDecimal carryover;
    private BigDecimal available;
}
