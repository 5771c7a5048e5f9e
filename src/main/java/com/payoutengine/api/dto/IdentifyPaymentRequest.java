package com.payoutengine.api.dto;

import com.payoutengine.platform.PlatformDTOs;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;

/**
 * DTO for crediting an incoming payment to virtual accounts.
 */
@Data
public class IdentifyPaymentRequest {

    @NotBlank(message = "Layer is required")
    private String layer;

    @NotEmpty(message = "At least one owner is required")
    private List<PlatformDTOs.@Valid PaymentOwner> owners;
}
