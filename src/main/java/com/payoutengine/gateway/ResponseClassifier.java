package com.payoutengine.gateway;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Maps a raw platform reply to a typed error, using the JSON-RPC error code.
 */
public final class ResponseClassifier {

    /**
     * A request with the same ext_key is still being processed.
     */
    public static final int IDEMPOTENT_REQUEST_IN_PROCESS = 4909;

    private ResponseClassifier() {
    }

    /**
     * @return the error described by the reply, or empty for a successful JSON-RPC result
     */
    public static Optional<GatewayError> errorOf(RpcReply reply) {
        JsonNode body = reply.getBody();
        JsonNode error = body != null ? body.get("error") : null;

        if (error != null && !error.isNull()) {
            Integer code = error.hasNonNull("code") && error.get("code").canConvertToInt()
                ? error.get("code").asInt()
                : null;
            String message = error.hasNonNull("message") ? error.get("message").asText() : error.toString();
            JsonNode data = error.get("data");
            ErrorKind kind = code != null && code == IDEMPOTENT_REQUEST_IN_PROCESS
                ? ErrorKind.DUPLICATE_SUBMISSION
                : ErrorKind.REMOTE;
            return Optional.of(new GatewayError(kind, message, code, data));
        }

        if (!reply.isHttpSuccess()) {
            String raw = reply.getRawBody() == null || reply.getRawBody().isBlank()
                ? "(empty body)"
                : reply.getRawBody();
            return Optional.of(new GatewayError(ErrorKind.REMOTE,
                "HTTP " + reply.getHttpStatus() + ": " + raw, reply.getHttpStatus(), null));
        }

        if (body == null || !body.has("result")) {
            return Optional.of(new GatewayError(ErrorKind.REMOTE,
                "Malformed JSON-RPC reply: " + reply.getRawBody(), reply.getHttpStatus(), null));
        }

        return Optional.empty();
    }
}
