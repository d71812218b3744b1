package com.envelope.backend.mappers;

import com.envelope.backend.dto.allocation.AllocationResponseDTO;
import com.envelope.backend.entities.Allocation;

public class AllocationMapper {

    private AllocationMapper() {}

    public static AllocationResponseDTO toResponseDTO(Allocation entity) {
        return new AllocationResponseDTO(
                entity.getId() != null ? entity.getId().toString() : null,
                entity.getBudgetId().toString(),
                entity.getPeriod(),
                MoneyMapper.toMajorUnits(entity.getAmount()),
                entity.getNotes(),
                entity.getCreatedAt()
        );
    }
}
