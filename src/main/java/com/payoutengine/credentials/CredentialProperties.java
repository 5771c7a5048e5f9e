package com.payoutengine.credentials;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for signing credential storage.
 */
@Getter
@Setter
@ToString
@Validated
@ConfigurationProperties(prefix = "payout-engine.credentials")
public class CredentialProperties {

    /** Password the stored private keys are encrypted with. Must be set outside of development. */
    @ToString.Exclude
    private String masterPassword;

    /** Smallest RSA modulus accepted for a signing key. */
    @Min(1024)
    private int minKeyBits = 2048;

    /** Modulus size used when generating a new key pair. */
    @Min(2048)
    private int generatedKeyBits = 2048;
}
