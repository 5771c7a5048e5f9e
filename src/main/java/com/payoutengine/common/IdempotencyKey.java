package com.payoutengine.common;

import java.util.UUID;

/**
 * Generates transfer idempotency keys.
 * Every transfer carries one as its {@code ext_key}, which is also what the
 * platform's duplicate-submission protection matches on.
 */
public final class IdempotencyKey {

    private IdempotencyKey() {
    }

    public static String generate() {
        return UUID.randomUUID().toString();
    }
}
