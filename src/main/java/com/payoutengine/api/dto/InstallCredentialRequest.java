package com.payoutengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.ToString;

/**
 * DTO for installing a layer's signing credential.
 */
@Data
public class InstallCredentialRequest {

    @NotBlank(message = "Private key is required")
    @ToString.Exclude
    private String privateKey;

    @NotBlank(message = "Signer id (sign-system) is required")
    private String signerId;

    /**
     * sign-thumbprint; derived from the key when omitted.
     */
    private String keyFingerprint;

    private String updatedBy;
}
