package com.payoutengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.time.LocalDate;

/**
 * DTO for calculating or executing one beneficiary's payout.
 */
@Data
public class PayoutRunRequest {

    @NotBlank(message = "Beneficiary ID is required")
    private String beneficiaryId;

    /**
     * Last day of the period, inclusive. Defaults to today.
     */
    private LocalDate periodEnd;

    private String createdBy;
}
