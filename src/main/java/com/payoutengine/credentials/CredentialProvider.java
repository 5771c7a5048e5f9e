package com.payoutengine.credentials;

import java.util.Optional;

/**
 * Source of the active credential per layer.
 * Injected into the signer and the gateway so tests can supply credentials directly.
 */
@FunctionalInterface
public interface CredentialProvider {

    Optional<Credential> find(Layer layer);
}
