package com.payoutengine.gateway;

public enum MethodKind {
    READ,
    MUTATING
}
