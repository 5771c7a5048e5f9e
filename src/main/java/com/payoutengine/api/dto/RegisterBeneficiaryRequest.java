package com.payoutengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.time.LocalDate;

@Data
public class RegisterBeneficiaryRequest {

    @NotBlank(message = "Beneficiary ID is required")
    private String beneficiaryId;

    private String name;

    @NotBlank(message = "Virtual account is required")
    private String virtualAccount;

    /**
     * Defaults to today for a new beneficiary.
     */
    private LocalDate onboardedOn;
}
