package com.payoutengine.signing;

import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON-RPC 2.0 request as it is signed and sent.
 */
@Value
public class RpcEnvelope {
    String id;
    String method;
    Map<String, Object> params;
    long timestamp;

    public Map<String, Object> toBody() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", id);
        body.put("jsonrpc", "2.0");
        body.put("method", method);
        body.put("params", params);
        body.put("timestamp", timestamp);
        return body;
    }
}
