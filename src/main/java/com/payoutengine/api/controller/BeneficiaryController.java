package com.payoutengine.api.controller;

import com.payoutengine.api.dto.RegisterBeneficiaryRequest;
import com.payoutengine.beneficiary.Beneficiary;
import com.payoutengine.beneficiary.BeneficiaryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/beneficiaries")
@RequiredArgsConstructor
@Tag(name = "Beneficiaries", description = "Local payee registry")
public class BeneficiaryController {

    private final BeneficiaryService beneficiaryService;

    @PostMapping
    @Operation(summary = "Register or update a beneficiary")
    public ResponseEntity<Beneficiary> register(@Valid @RequestBody RegisterBeneficiaryRequest request) {
        Beneficiary beneficiary = beneficiaryService.register(
            request.getBeneficiaryId(),
            request.getName(),
            request.getVirtualAccount(),
            request.getOnboardedOn()
        );
        return ResponseEntity.ok(beneficiary);
    }

    @GetMapping
    @Operation(summary = "List beneficiaries")
    public ResponseEntity<List<Beneficiary>> list() {
        return ResponseEntity.ok(beneficiaryService.getAll());
    }

    @GetMapping("/{beneficiaryId}")
    @Operation(summary = "Get a beneficiary")
    public ResponseEntity<Beneficiary> get(@PathVariable String beneficiaryId) {
        return ResponseEntity.ok(beneficiaryService.getBeneficiary(beneficiaryId));
    }
}
