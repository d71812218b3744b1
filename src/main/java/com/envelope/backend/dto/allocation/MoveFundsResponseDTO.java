package com.envelope.backend.dto.allocation;

public record MoveFundsResponseDTO(
        AllocationResponseDTO sourceAllocation,
        AllocationResponseDTO destAllocation
) {
}
