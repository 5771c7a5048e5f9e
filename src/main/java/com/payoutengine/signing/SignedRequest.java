package com.payoutengine.signing;

import com.payoutengine.credentials.Layer;
import lombok.Value;

/**
 * A request body together with its signature.
 * {@code body} holds exactly the bytes that were signed and must be sent unchanged.
 */
@Value
public class SignedRequest {
    Layer layer;
    String requestId;
    String method;
    String body;

    /**
     * Base64 RSA-SHA256 signature, no line breaks ({@code sign-data}).
     */
    String signature;

    /**
     * {@code sign-system}
     */
    String signerId;

    /**
     * {@code sign-thumbprint}
     */
    String keyFingerprint;
}
