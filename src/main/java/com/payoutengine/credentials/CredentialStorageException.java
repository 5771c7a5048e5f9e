package com.payoutengine.credentials;

import com.payoutengine.common.exception.PayoutEngineException;

/**
 * Thrown when credentials cannot be encrypted, decrypted or persisted.
 */
public class CredentialStorageException extends PayoutEngineException {

    public CredentialStorageException(String message) {
        super(message);
    }

    public CredentialStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
