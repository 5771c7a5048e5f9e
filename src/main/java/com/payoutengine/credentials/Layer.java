package com.payoutengine.credentials;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.payoutengine.common.exception.ValidationException;

import java.util.Locale;

/**
 * Deployment layer of the platform. Each layer has its own endpoint,
 * its own signing credential and its own data.
 */
public enum Layer {

    /**
     * Pre-production sandbox.
     */
    SANDBOX("pre"),

    /**
     * Live money.
     */
    LIVE("prod");

    private final String wireName;

    Layer(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Accepts both the wire names ({@code pre}, {@code prod}) and the enum names.
     */
    @JsonCreator
    public static Layer parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Layer is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Layer layer : values()) {
            if (layer.wireName.equals(normalized) || layer.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return layer;
            }
        }
        throw new ValidationException("Invalid layer: " + value + ". Must be \"pre\" or \"prod\"");
    }
}
