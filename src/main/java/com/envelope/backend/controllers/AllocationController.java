package com.envelope.backend.controllers;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.envelope.backend.dto.allocation.AllocationRequest;
import com.envelope.backend.dto.allocation.AllocationResponseDTO;
import com.envelope.backend.dto.allocation.MoveFundsRequest;
import com.envelope.backend.dto.allocation.MoveFundsResponseDTO;
import com.envelope.backend.services.AllocationService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/allocations")
@RequiredArgsConstructor
public class AllocationController {

    private final AllocationService allocationService;

    @PostMapping
    public ResponseEntity<AllocationResponseDTO> createAllocation(@Valid @RequestBody AllocationRequest request) {
        AllocationResponseDTO response = allocationService.createAllocation(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<List<AllocationResponseDTO>> listAllocations(
            @RequestParam(required = false) String budgetId,
            @RequestParam(required = false) String period
    ) {
        return ResponseEntity.ok(allocationService.listAllocations(budgetId, period));
    }

    @GetMapping("/{allocationId}")
    public ResponseEntity<AllocationResponseDTO> getAllocation(@PathVariable String allocationId) {
        return ResponseEntity.ok(allocationService.getAllocation(allocationId));
    }

    @PutMapping("/{allocationId}")
    public ResponseEntity<AllocationResponseDTO> updateAllocation(
            @PathVariable String allocationId,
            @Valid @RequestBody AllocationRequest request
    ) {
        return ResponseEntity.ok(allocationService.updateAllocation(allocationId, request));
    }

    @PostMapping("/move")
    public ResponseEntity<MoveFundsResponseDTO> moveFunds(@Valid @RequestBody MoveFundsRequest request) {
        MoveFundsResponseDTO response = allocationService.moveFunds(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @DeleteMapping("/{allocationId}")
    public ResponseEntity<Void> deleteAllocation(@PathVariable String allocationId) {
        allocationService.deleteAllocation(allocationId);
        return ResponseEntity.noContent().build();
    }
}
