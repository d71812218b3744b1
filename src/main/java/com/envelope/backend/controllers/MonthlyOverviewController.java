package com.envelope.backend.controllers;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.envelope.backend.dto.ApiResponse;
import com.envelope.backend.dto.overview.MonthlyOverviewResponseDTO;
import com.envelope.backend.services.MonthlyOverviewService;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/monthly-overview")
@RequiredArgsConstructor
public class MonthlyOverviewController {

    private final MonthlyOverviewService monthlyOverviewService;

    @GetMapping
    public ResponseEntity<ApiResponse<MonthlyOverviewResponseDTO>> getMonthlyOverview(
            @RequestParam String month
    ) {
        MonthlyOverviewResponseDTO overview = monthlyOverviewService.getMonthlyOverview(month);
        return ResponseEntity.ok(ApiResponse.success(overview, "Monthly overview loaded successfully"));
    }
}
