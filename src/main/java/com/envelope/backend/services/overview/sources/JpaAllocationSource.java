package com.envelope.backend.services.overview.sources;

import java.time.YearMonth;
import java.util.List;

import org.springframework.stereotype.Component;

import com.envelope.backend.entities.Allocation;
import com.envelope.backend.repositories.AllocationRepository;
import com.envelope.backend.services.overview.Periods;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class JpaAllocationSource implements AllocationSource {

    private final AllocationRepository allocationRepository;

    @Override
    public List<Allocation> listThrough(YearMonth throughPeriod) {
        return allocationRepository.findByPeriodLessThanEqual(Periods.format(throughPeriod));
    }
}
