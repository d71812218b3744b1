package com.envelope.backend.services.overview.sources;

import java.time.YearMonth;
import java.util.List;

import com.envelope.backend.entities.Allocation;

public interface AllocationSource {

    /** Every allocation whose period is on or before {@code throughPeriod}. */
    List<Allocation> listThrough(YearMonth throughPeriod);
}
