package com.payoutengine.signing;

import com.payoutengine.common.exception.PayoutEngineException;
import com.payoutengine.credentials.Credential;
import com.payoutengine.credentials.CredentialProvider;
import com.payoutengine.credentials.Layer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.Signature;
import java.time.Clock;
import java.util.Base64;
import java.util.Map;
import java.util.UUID;

/**
 * Signs outbound platform calls with the active key of a layer.
 *
 * Signing process:
 * 1. Build the JSON-RPC envelope (id, method, params, timestamp)
 * 2. Serialize it canonically; these bytes are the request body
 * 3. Sign the body with SHA256withRSA
 * 4. Base64-encode the signature without line breaks
 *
 * Stateless apart from reading the credential provider.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RequestSigner {

    private final CredentialProvider credentials;
    private final Clock clock;

    public SignedRequest sign(Layer layer, String method, Map<String, Object> params) {
        return sign(layer, new RpcEnvelope(UUID.randomUUID().toString(), method, params, clock.millis()));
    }

    public SignedRequest sign(Layer layer, RpcEnvelope envelope) {
        Credential credential = activeCredential(layer);
        String body = CanonicalJson.write(envelope.toBody());

        String signature;
        try {
            Signature engine = Signature.getInstance("SHA256withRSA");
            engine.initSign(credential.getPrivateKey());
            engine.update(body.getBytes(StandardCharsets.UTF_8));
            signature = Base64.getEncoder().encodeToString(engine.sign());
        } catch (GeneralSecurityException e) {
            throw new SigningException("Signing key for layer " + layer.wireName() + " is unusable: " + e.getMessage(),
                layer, e);
        }

        log.debug("Signed request: layer={}, method={}, id={}, bodyBytes={}",
            layer.wireName(), envelope.getMethod(), envelope.getId(), body.length());

        return new SignedRequest(layer, envelope.getId(), envelope.getMethod(), body, signature,
            credential.getSignerId(), credential.getKeyFingerprint());
    }

    private Credential activeCredential(Layer layer) {
        try {
            return credentials.find(layer)
                .orElseThrow(() -> new SigningException(
                    "No signing credential configured for layer " + layer.wireName(), layer));
        } catch (SigningException e) {
            throw e;
        } catch (PayoutEngineException e) {
            throw new SigningException("Signing credential for layer " + layer.wireName()
                + " cannot be loaded: " + e.getMessage(), layer, e);
        }
    }
}
