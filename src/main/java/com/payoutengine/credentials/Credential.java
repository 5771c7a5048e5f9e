package com.payoutengine.credentials;

import lombok.ToString;
import lombok.Value;

import java.security.PrivateKey;
import java.time.Instant;

/**
 * Active signing credential of one layer.
 *
 * Instances are immutable and replaced as a whole, so a signer that has read
 * a credential keeps using exactly that key even if a new one is installed
 * while it is signing.
 */
@Value
public class Credential {

    Layer layer;

    @ToString.Exclude
    PrivateKey privateKey;

    /**
     * Institution-assigned signer identifier ({@code sign-system} header).
     */
    String signerId;

    /**
     * Fingerprint the platform uses to find the matching public key
     * ({@code sign-thumbprint} header).
     */
    String keyFingerprint;

    Instant installedAt;
}
