package com.payoutengine.signing;

import com.payoutengine.common.exception.PayoutEngineException;
import com.payoutengine.credentials.Layer;

/**
 * Thrown when a request cannot be signed: no credential for the layer, or a
 * key the signature engine rejects. Fatal to the call and never retried automatically.
 */
public class SigningException extends PayoutEngineException {

    private final Layer layer;

    public SigningException(String message, Layer layer) {
        super(message);
        this.layer = layer;
    }

    public SigningException(String message, Layer layer, Throwable cause) {
        super(message, cause);
        this.layer = layer;
    }

    public Layer getLayer() {
        return layer;
    }
}
