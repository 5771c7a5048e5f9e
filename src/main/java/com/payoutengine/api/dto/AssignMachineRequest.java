package com.payoutengine.api.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

/**
 * DTO for assigning a vending machine to a beneficiary.
 */
@Data
public class AssignMachineRequest {

    @NotBlank(message = "Machine ID is required")
    private String machineId;

    @NotBlank(message = "Beneficiary ID is required")
    private String beneficiaryId;

    @NotNull(message = "Commission percent is required")
    @DecimalMin(value = "0", message = "Commission percent must be at least 0")
    @DecimalMax(value = "100", message = "Commission percent must be at most 100")
    @Digits(integer = 3, fraction = 1, message = "Commission percent allows one decimal place")
    private BigDecimal commissionPercent;

    private String createdBy;
}
