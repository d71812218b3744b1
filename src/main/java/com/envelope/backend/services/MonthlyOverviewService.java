package com.envelope.backend.services;

import java.time.YearMonth;

import org.springframework.stereotype.Service;

import com.envelope.backend.dto.overview.MonthlyOverviewResponseDTO;
import com.envelope.backend.exceptions.BadRequestException;
import com.envelope.backend.mappers.MonthlyOverviewMapper;
import com.envelope.backend.services.overview.MonthlyOverview;
import com.envelope.backend.services.overview.MonthlyOverviewCalculator;
import com.envelope.backend.services.overview.Periods;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class MonthlyOverviewService {

    private final MonthlyOverviewCalculator monthlyOverviewCalculator;

    public MonthlyOverviewResponseDTO getMonthlyOverview(String month) {
        if (!Periods.isValid(month)) {
            throw new BadRequestException("Invalid month format: \"" + month + "\". Expected YYYY-MM (e.g., \"2026-02\").");
        }
        YearMonth period = Periods.parse(month);

        MonthlyOverview overview = monthlyOverviewCalculator.computeMonthlyOverview(period);
        log.debug("[Overview] Mapping {} envelopes for {}", overview.budgetSummaries().size(), month);

        return MonthlyOverviewMapper.toResponseDTO(overview);
    }
}
