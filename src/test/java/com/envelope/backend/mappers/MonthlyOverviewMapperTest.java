package com.envelope.backend.mappers;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.envelope.backend.dto.overview.BudgetSummaryDTO;
import com.envelope.backend.dto.overview.MonthlyOverviewResponseDTO;
import com.envelope.backend.enums.BudgetType;
import com.envelope.backend.services.overview.BudgetSummary;
import com.envelope.backend.services.overview.MonthlyOverview;

class MonthlyOverviewMapperTest {

    @Test
    void convertsEveryAmountToMajorUnits() {
        UUID budgetId = UUID.randomUUID();
        MonthlyOverview overview = MonthlyOverview.builder()
                .period(YearMonth.of(2026, 2))
                .readyToAssign(-1_000_000)
                .totalAllocated(2_000_000)
                .totalSpent(40_000)
                .capitalBalance(12_345)
                .availableFunds(1_000_000)
                .savingsRate(0.25)
                .budgetSummaries(List.of(new BudgetSummary(
                        budgetId, "Groceries", BudgetType.SPENDING, 60_000, 500_000, 40_000, -1_500, 458_500)))
                .build();

        MonthlyOverviewResponseDTO dto = MonthlyOverviewMapper.toResponseDTO(overview);

        assertEquals("2026-02", dto.getPeriod());
        assertEquals(new BigDecimal("-10000.00"), dto.getReadyToAssign());
        assertEquals(new BigDecimal("20000.00"), dto.getTotalAllocated());
        assertEquals(new BigDecimal("400.00"), dto.getTotalSpent());
        assertEquals(new BigDecimal("123.45"), dto.getCapitalBalance());
        assertEquals(new BigDecimal("10000.00"), dto.getAvailableFunds());
        assertEquals(0.25, dto.getSavingsRate());

        BudgetSummaryDTO summary = dto.getBudgetSummaries().get(0);
        assertEquals(budgetId.toString(), summary.getBudgetId());
        assertEquals("SPENDING", summary.getType());
        assertEquals(new BigDecimal("600.00"), summary.getTargetAmount());
        assertEquals(new BigDecimal("5000.00"), summary.getAllocated());
        assertEquals(new BigDecimal("400.00"), summary.getSpent());
        assertEquals(new BigDecimal("-15.00"), summary.getCarryover());
        assertEquals(new BigDecimal("4585.00"), summary.getAvailable());
    }

    @ParameterizedTest
    @EnumSource(BudgetType.class)
    void budgetTypesKeepTheirWireName(BudgetType type) {
        assertEquals(type.name(), MonthlyOverviewMapper.toWireType(type));
    }

    @Test
    void missingTypeIsReportedAsSpending() {
        assertEquals("SPENDING", MonthlyOverviewMapper.toWireType(null));
    }
}
