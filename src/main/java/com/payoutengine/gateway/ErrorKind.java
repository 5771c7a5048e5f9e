package com.payoutengine.gateway;

/**
 * Typed outcome of a failed gateway call. Callers branch on this, never on message text.
 */
public enum ErrorKind {
    /** Malformed input or a method that is not allowed. Nothing was sent. */
    VALIDATION,
    /** No usable signing credential. Nothing was sent. */
    SIGNING,
    /** The admission window of this call is still closed. Nothing was sent. */
    RATE_LIMIT_DEFERRED,
    /** The platform already processes a request with the same idempotency key. */
    DUPLICATE_SUBMISSION,
    /** The platform rejected the call. */
    REMOTE,
    /** No reply within the read timeout. The remote outcome is unknown. */
    TIMEOUT
}
