package com.payoutengine.credentials;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Non-secret view of a layer's credential for the console.
 */
@Value
@Builder
public class CredentialStatus {
    Layer layer;
    boolean configured;
    String signerId;
    String fingerprintPreview;
    Instant updatedAt;

    public static CredentialStatus notConfigured(Layer layer) {
        return CredentialStatus.builder().layer(layer).configured(false).build();
    }
}
