package com.payoutengine.gateway;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.payoutengine.common.exception.ValidationException;
import com.payoutengine.credentials.Layer;
import com.payoutengine.signing.SigningException;
import lombok.Value;

/**
 * Uniform envelope of every gateway call: {@code {result, error, _cache}}.
 * Exactly one of {@code result} and {@code error} describes the outcome; a
 * deferred call may carry both the error and the last known result.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GatewayResponse {
    Layer layer;
    String method;
    JsonNode result;
    GatewayError error;

    @JsonProperty("_cache")
    CacheInfo cache;

    public static GatewayResponse success(Layer layer, String method, JsonNode result, CacheInfo cache) {
        return new GatewayResponse(layer, method, result, null, cache);
    }

    public static GatewayResponse failure(Layer layer, String method, GatewayError error, CacheInfo cache) {
        return new GatewayResponse(layer, method, null, error, cache);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return error == null;
    }

    @JsonIgnore
    public boolean isCached() {
        return cache != null && cache.isCached();
    }

    /**
     * The result of a successful call.
     *
     * @throws GatewayException or {@link SigningException} / {@link ValidationException}
     *         matching the error kind
     */
    public JsonNode orThrow() {
        if (error == null) {
            return result;
        }
        String message = method + ": " + error.getMessage();
        switch (error.getKind()) {
            case VALIDATION:
                throw new ValidationException(error.getMessage());
            case SIGNING:
                throw new SigningException(error.getMessage(), layer);
            case RATE_LIMIT_DEFERRED:
                throw new RateLimitDeferredException(message, cache != null ? cache.getNextAllowedAt() : null);
            case DUPLICATE_SUBMISSION:
                throw new DuplicateSubmissionException(message, error.getCode());
            case TIMEOUT:
                throw new GatewayTimeoutException(message);
            default:
                throw new RemoteCallException(message, error.getCode());
        }
    }
}
