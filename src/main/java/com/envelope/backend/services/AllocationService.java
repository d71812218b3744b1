package com.envelope.backend.services;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.envelope.backend.dto.allocation.AllocationRequest;
import com.envelope.backend.dto.allocation.AllocationResponseDTO;
import com.envelope.backend.dto.allocation.MoveFundsRequest;
import com.envelope.backend.dto.allocation.MoveFundsResponseDTO;
import com.envelope.backend.entities.Allocation;
import com.envelope.backend.entities.Budget;
import com.envelope.backend.exceptions.BadRequestException;
import com.envelope.backend.exceptions.BusinessException;
import com.envelope.backend.exceptions.ResourceNotFoundException;
import com.envelope.backend.mappers.AllocationMapper;
import com.envelope.backend.mappers.MoneyMapper;
import com.envelope.backend.repositories.AllocationRepository;
import com.envelope.backend.repositories.BudgetRepository;
import com.envelope.backend.services.overview.Periods;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Assigns money to envelopes. Allocations are append-only corrections: moving funds writes a
 * negative row on the source and a positive row on the destination instead of editing either.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AllocationService {

    private final AllocationRepository allocationRepository;
    private final BudgetRepository budgetRepository;

    @Transactional
    public AllocationResponseDTO createAllocation(AllocationRequest request) {
        UUID budgetId = parseUuid(request.getBudgetId(), "budgetId");
        String period = requirePeriod(request.getPeriod());
        long amount = toMinorUnits(request.getAmount());
        if (amount == 0L) {
            throw new BadRequestException("Allocation amount cannot be zero");
        }

        Budget budget = findActiveBudgetOrThrow(budgetId);

        Allocation saved = allocationRepository.save(Allocation.builder()
                .budgetId(budget.getId())
                .period(period)
                .amount(amount)
                .notes(request.getNotes())
                .build());

        log.info("[Allocation] {} minor units -> \"{}\" for {}", amount, budget.getName(), period);
        return AllocationMapper.toResponseDTO(saved);
    }

    /**
     * Replaces budget, period, amount and notes of an existing allocation. Moving it to another
     * envelope follows the same rules as creating it there.
     */
    @Transactional
    public AllocationResponseDTO updateAllocation(String allocationId, AllocationRequest request) {
        Allocation allocation = findAllocationOrThrow(parseUuid(allocationId, "allocationId"));

        UUID budgetId = parseUuid(request.getBudgetId(), "budgetId");
        String period = requirePeriod(request.getPeriod());
        long amount = toMinorUnits(request.getAmount());
        if (amount == 0L) {
            throw new BadRequestException("Allocation amount cannot be zero");
        }

        Budget budget = findActiveBudgetOrThrow(budgetId);

        allocation.setBudgetId(budget.getId());
        allocation.setPeriod(period);
        allocation.setAmount(amount);
        allocation.setNotes(request.getNotes());

        Allocation saved = allocationRepository.save(allocation);
        log.info("[Allocation] Updated allocation {}: {} minor units -> \"{}\" for {}",
                saved.getId(), amount, budget.getName(), period);
        return AllocationMapper.toResponseDTO(saved);
    }

    @Transactional(readOnly = true)
    public AllocationResponseDTO getAllocation(String allocationId) {
        return AllocationMapper.toResponseDTO(findAllocationOrThrow(parseUuid(allocationId, "allocationId")));
    }

    /**
     * Allocations ordered by period, optionally narrowed to one budget and/or one period.
     */
    @Transactional(readOnly = true)
    public List<AllocationResponseDTO> listAllocations(String budgetId, String period) {
        UUID budgetUuid = budgetId != null ? parseUuid(budgetId, "budgetId") : null;
        String periodFilter = period != null ? requirePeriod(period) : null;

        List<Allocation> allocations;
        if (budgetUuid != null && periodFilter != null) {
            allocations = allocationRepository.findByBudgetIdAndPeriodOrderByCreatedAtAsc(budgetUuid, periodFilter);
        } else if (budgetUuid != null) {
            allocations = allocationRepository.findByBudgetIdOrderByPeriodAscCreatedAtAsc(budgetUuid);
        } else if (periodFilter != null) {
            allocations = allocationRepository.findByPeriodOrderByCreatedAtAsc(periodFilter);
        } else {
            allocations = allocationRepository.findAllByOrderByPeriodAscCreatedAtAsc();
        }

        return allocations.stream()
                .map(AllocationMapper::toResponseDTO)
                .toList();
    }

    @Transactional
    public MoveFundsResponseDTO moveFunds(MoveFundsRequest request) {
        UUID sourceId = parseUuid(request.getSourceBudgetId(), "sourceBudgetId");
        UUID destId = parseUuid(request.getDestBudgetId(), "destBudgetId");
        if (sourceId.equals(destId)) {
            throw new BadRequestException("Source and destination budgets must differ");
        }

        String period = requirePeriod(request.getPeriod());
        long amount = toMinorUnits(request.getAmount());
        if (amount <= 0L) {
            throw new BadRequestException("Move amount must be positive");
        }

        Budget source = findActiveBudgetOrThrow(sourceId);
        Budget dest = findActiveBudgetOrThrow(destId);

        Allocation outgoing = allocationRepository.save(Allocation.builder()
                .budgetId(source.getId())
                .period(period)
                .amount(-amount)
                .notes(request.getNotes())
                .build());
        Allocation incoming = allocationRepository.save(Allocation.builder()
                .budgetId(dest.getId())
                .period(period)
                .amount(amount)
                .notes(request.getNotes())
                .build());

        log.info("[Allocation] Moved {} minor units \"{}\" -> \"{}\" for {}",
                amount, source.getName(), dest.getName(), period);

        return new MoveFundsResponseDTO(
                AllocationMapper.toResponseDTO(outgoing),
                AllocationMapper.toResponseDTO(incoming)
        );
    }

    @Transactional
    public void deleteAllocation(String allocationId) {
        UUID uuid = parseUuid(allocationId, "allocationId");
        Allocation allocation = findAllocationOrThrow(uuid);

        allocationRepository.delete(allocation);
        log.info("[Allocation] Deleted allocation {} ({} minor units, {})",
                uuid, allocation.getAmount(), allocation.getPeriod());
    }

    private Allocation findAllocationOrThrow(UUID allocationId) {
        return allocationRepository.findById(allocationId)
                .orElseThrow(() -> new ResourceNotFoundException("Allocation not found"));
    }

    private Budget findActiveBudgetOrThrow(UUID budgetId) {
        Budget budget = budgetRepository.findById(budgetId)
                .orElseThrow(() -> new ResourceNotFoundException("Budget not found: " + budgetId));
        if (budget.isArchived()) {
            throw new BusinessException("Budget \"" + budget.getName() + "\" is archived");
        }
        return budget;
    }

    private String requirePeriod(String period) {
        if (!Periods.isValid(period)) {
            throw new BadRequestException("Invalid period format: \"" + period + "\". Expected YYYY-MM.");
        }
        return period;
    }

    private long toMinorUnits(BigDecimal amount) {
        if (amount == null) {
            throw new BadRequestException("amount is required");
        }
        try {
            return MoneyMapper.toMinorUnits(amount);
        } catch (ArithmeticException e) {
            throw new BadRequestException("amount must have at most 2 decimal places");
        }
    }

    private UUID parseUuid(String raw, String fieldName) {
        if (raw == null) {
            throw new BadRequestException(fieldName + " is required");
        }
        try {
            return UUID.fromString(raw);
        } catch (IllegalArgumentException e) {
            throw new BadRequestException("Invalid " + fieldName);
        }
    }
}
