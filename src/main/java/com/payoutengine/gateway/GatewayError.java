package com.payoutengine.gateway;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GatewayError {
    ErrorKind kind;
    String message;

    /**
     * JSON-RPC error code or HTTP status of the remote reply; null for local errors.
     */
    Integer code;

    /**
     * {@code error.data} of the remote reply, if present.
     */
    JsonNode data;

    public static GatewayError local(ErrorKind kind, String message) {
        return new GatewayError(kind, message, null, null);
    }
}
