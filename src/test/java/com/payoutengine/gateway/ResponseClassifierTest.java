package com.payoutengine.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ResponseClassifier.
 */
class ResponseClassifierTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void testSuccess() throws Exception {
        assertTrue(ResponseClassifier.errorOf(reply(200, "{\"jsonrpc\":\"2.0\",\"result\":null}")).isEmpty());
    }

    @Test
    void testDuplicateSubmission() throws Exception {
        GatewayError error = ResponseClassifier.errorOf(
            reply(200, "{\"error\":{\"code\":4909,\"message\":\"in process\"}}")).orElseThrow();

        assertEquals(ErrorKind.DUPLICATE_SUBMISSION, error.getKind());
    }

    @Test
    void testRemoteErrorOnHttpFailure() throws Exception {
        // the JSON-RPC error wins over the HTTP status
        GatewayError error = ResponseClassifier.errorOf(
            reply(400, "{\"error\":{\"code\":4000,\"message\":\"Invalid params\"}}")).orElseThrow();

        assertEquals(ErrorKind.REMOTE, error.getKind());
        assertEquals("Invalid params", error.getMessage());
        assertEquals(4000, error.getCode());
    }

    @Test
    void testErrorWithoutMessage() throws Exception {
        GatewayError error = ResponseClassifier.errorOf(reply(200, "{\"error\":{\"code\":\"x\"}}")).orElseThrow();

        assertNull(error.getCode());
        assertEquals("{\"code\":\"x\"}", error.getMessage());
    }

    @Test
    void testNonJsonFailure() {
        Optional<GatewayError> error = ResponseClassifier.errorOf(new RpcReply(503, null, ""));

        assertEquals("HTTP 503: (empty body)", error.orElseThrow().getMessage());
    }

    @Test
    void testMalformedReply() throws Exception {
        GatewayError error = ResponseClassifier.errorOf(reply(200, "{\"jsonrpc\":\"2.0\"}")).orElseThrow();

        assertEquals(ErrorKind.REMOTE, error.getKind());
        assertTrue(error.getMessage().startsWith("Malformed JSON-RPC reply"));
    }

    private RpcReply reply(int status, String body) throws Exception {
        return new RpcReply(status, objectMapper.readTree(body), body);
    }
}
