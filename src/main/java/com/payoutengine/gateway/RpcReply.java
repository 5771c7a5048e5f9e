package com.payoutengine.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/**
 * Raw platform reply. {@code body} is null when the reply was not JSON.
 */
@Value
public class RpcReply {
    int httpStatus;
    JsonNode body;
    String rawBody;

    public boolean isHttpSuccess() {
        return httpStatus >= 200 && httpStatus < 300;
    }
}
