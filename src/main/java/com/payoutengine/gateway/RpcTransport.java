package com.payoutengine.gateway;

import com.payoutengine.signing.SignedRequest;

/**
 * Delivers a signed request to the platform endpoint of its layer.
 *
 * Implementations return every reply that arrived, whatever its status, and
 * throw {@link RpcTimeoutException} only when the read timeout elapsed.
 */
public interface RpcTransport {

    /**
     * @throws RpcTimeoutException if no reply arrived in time
     * @throws RpcTransportException if the request could not be delivered
     */
    RpcReply send(SignedRequest request);
}
