package com.envelope.backend.services;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.envelope.backend.dto.budget.BudgetRequest;
import com.envelope.backend.dto.budget.BudgetResponse;
import com.envelope.backend.entities.Budget;
import com.envelope.backend.enums.BudgetType;
import com.envelope.backend.enums.TargetCadence;
import com.envelope.backend.exceptions.BadRequestException;
import com.envelope.backend.exceptions.ConflictException;
import com.envelope.backend.exceptions.ResourceNotFoundException;
import com.envelope.backend.mappers.MoneyMapper;
import com.envelope.backend.repositories.BudgetRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class BudgetService {

    private final BudgetRepository budgetRepository;

    @Transactional
    public BudgetResponse createBudget(BudgetRequest request) {
        validateRequest(request);

        String name = request.getName().trim();
        if (budgetRepository.existsByNameIgnoreCaseAndArchivedFalse(name)) {
            throw new ConflictException("A budget named \"" + name + "\" already exists");
        }

        Budget budget = Budget.builder()
                .name(name)
                .type(request.getType() != null ? request.getType() : BudgetType.SPENDING)
                .targetAmount(toMinorUnits(request.getTargetAmount()))
                .targetCadence(request.getTargetCadence())
                .targetCadenceMonths(request.getTargetCadence() == TargetCadence.CUSTOM
                        ? request.getTargetCadenceMonths()
                        : null)
                .archived(false)
                .build();

        Budget saved = saveWithUniqueName(budget);
        log.info("[Budget] Created {} budget \"{}\" ({})", saved.getType(), saved.getName(), saved.getId());
        return toResponse(saved);
    }

    @Transactional
    public BudgetResponse updateBudget(String budgetId, BudgetRequest request) {
        UUID uuid = parseUuid(budgetId, "budgetId");
        Budget budget = findBudgetOrThrow(uuid);
        validateRequest(request);

        String name = request.getName().trim();
        if (budgetRepository.existsByNameIgnoreCaseAndArchivedFalseAndIdNot(name, uuid)) {
            throw new ConflictException("A budget named \"" + name + "\" already exists");
        }

        budget.setName(name);
        budget.setType(request.getType() != null ? request.getType() : budget.getType());
        budget.setTargetAmount(toMinorUnits(request.getTargetAmount()));
        budget.setTargetCadence(request.getTargetCadence());
        budget.setTargetCadenceMonths(request.getTargetCadence() == TargetCadence.CUSTOM
                ? request.getTargetCadenceMonths()
                : null);

        Budget saved = saveWithUniqueName(budget);
        log.info("[Budget] Updated budget \"{}\" ({})", saved.getName(), saved.getId());
        return toResponse(saved);
    }

    @Transactional(readOnly = true)
    public BudgetResponse getBudget(String budgetId) {
        return toResponse(findBudgetOrThrow(parseUuid(budgetId, "budgetId")));
    }

    @Transactional(readOnly = true)
    public List<BudgetResponse> listActiveBudgets() {
        return budgetRepository.findByArchivedFalseOrderByNameAsc().stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional
    public BudgetResponse archiveBudget(String budgetId) {
        Budget budget = findBudgetOrThrow(parseUuid(budgetId, "budgetId"));

        if (budget.isArchived()) {
            return toResponse(budget);
        }

        budget.setArchived(true);
        Budget saved = budgetRepository.save(budget);
        log.info("[Budget] Archived budget \"{}\" ({})", saved.getName(), saved.getId());
        return toResponse(saved);
    }

    // Concurrent writers can both pass the exists check; uq_budget_active_name rejects the second.
    private Budget saveWithUniqueName(Budget budget) {
        try {
            return budgetRepository.saveAndFlush(budget);
        } catch (DataIntegrityViolationException e) {
            log.warn("[Budget] Name collision on save for \"{}\": {}", budget.getName(), e.getMostSpecificCause().getMessage());
            throw new ConflictException("A budget named \"" + budget.getName() + "\" already exists");
        }
    }

    private Budget findBudgetOrThrow(UUID budgetId) {
        return budgetRepository.findById(budgetId)
                .orElseThrow(() -> new ResourceNotFoundException("Budget not found"));
    }

    private void validateRequest(BudgetRequest request) {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new BadRequestException("Name is required");
        }
        if (request.getTargetAmount() == null) {
            throw new BadRequestException("Target amount is required");
        }
        if (request.getTargetAmount().compareTo(BigDecimal.ZERO) < 0) {
            throw new BadRequestException("Target amount cannot be negative");
        }
        if (request.getTargetCadence() == TargetCadence.CUSTOM
                && (request.getTargetCadenceMonths() == null || request.getTargetCadenceMonths() <= 0)) {
            throw new BadRequestException("A custom cadence needs a positive number of months");
        }
    }

    private long toMinorUnits(BigDecimal amount) {
        try {
            return MoneyMapper.toMinorUnits(amount);
        } catch (ArithmeticException e) {
            throw new BadRequestException("Target amount must have at most 2 decimal places");
        }
    }

    private UUID parseUuid(String raw, String fieldName) {
        try {
            return UUID.fromString(raw);
        } catch (IllegalArgumentException e) {
            throw new BadRequestException("Invalid " + fieldName);
        }
    }

    private BudgetResponse toResponse(Budget budget) {
        BudgetResponse response = new BudgetResponse();

        response.setId(budget.getId());
        response.setName(budget.getName());
        response.setType(budget.getType());
        response.setTargetAmount(MoneyMapper.toMajorUnits(budget.getTargetAmount()));
        response.setTargetCadence(budget.getTargetCadence());
        response.setTargetCadenceMonths(budget.getTargetCadenceMonths());
        response.setArchived(budget.isArchived());

        response.setCreatedAt(budget.getCreatedAt());
        response.setUpdatedAt(budget.getUpdatedAt());

        return response;
    }
}
