package com.envelope.backend.mappers;

import static com.envelope.backend.mappers.MoneyMapper.toMajorUnits;

import com.envelope.backend.dto.overview.BudgetSummaryDTO;
import com.envelope.backend.dto.overview.MonthlyOverviewResponseDTO;
import com.envelope.backend.enums.BudgetType;
import com.envelope.backend.services.overview.BudgetSummary;
import com.envelope.backend.services.overview.MonthlyOverview;
import com.envelope.backend.services.overview.Periods;

public class MonthlyOverviewMapper {

    private MonthlyOverviewMapper() {}

    public static MonthlyOverviewResponseDTO toResponseDTO(MonthlyOverview overview) {
        return MonthlyOverviewResponseDTO.builder()
                .period(Periods.format(overview.period()))
                .readyToAssign(toMajorUnits(overview.readyToAssign()))
                .totalAllocated(toMajorUnits(overview.totalAllocated()))
                .totalSpent(toMajorUnits(overview.totalSpent()))
                .capitalBalance(toMajorUnits(overview.capitalBalance()))
                .availableFunds(toMajorUnits(overview.availableFunds()))
                .savingsRate(overview.savingsRate())
                .budgetSummaries(overview.budgetSummaries().stream()
                        .map(MonthlyOverviewMapper::toSummaryDTO)
                        .toList())
                .build();
    }

    public static BudgetSummaryDTO toSummaryDTO(BudgetSummary summary) {
        return BudgetSummaryDTO.builder()
                .budgetId(summary.budgetId() != null ? summary.budgetId().toString() : null)
                .name(summary.name())
                .type(toWireType(summary.type()))
                .targetAmount(toMajorUnits(summary.targetAmount()))
                .allocated(toMajorUnits(summary.allocated()))
                .spent(toMajorUnits(summary.spent()))
                .carryover(toMajorUnits(summary.carryover()))
                .available(toMajorUnits(summary.available()))
                .build();
    }

    static String toWireType(BudgetType type) {
        return (type != null ? type : BudgetType.SPENDING).name();
    }
}
