package com.payoutengine.common;

/**
 * Supported currencies.
 * The platform settles nominal accounts in rubles only.
 */
public enum Currency {
    RUB
}
