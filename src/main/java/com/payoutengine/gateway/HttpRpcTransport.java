package com.payoutengine.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payoutengine.signing.SignedRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;

/**
 * JSON-RPC over HTTPS to the platform.
 *
 * Sends the signed body unchanged with the headers:
 * - sign-data: Base64 RSA-SHA256 signature of the body
 * - sign-thumbprint: fingerprint of the signing key
 * - sign-system: signer id
 *
 * Connect and read timeouts are fixed per client; a call that exceeds the
 * read timeout is abandoned and reported as a timeout.
 */
@Component
@Slf4j
public class HttpRpcTransport implements RpcTransport {

    private final RestTemplate restTemplate;
    private final GatewayProperties properties;
    private final ObjectMapper objectMapper;

    @Autowired
    public HttpRpcTransport(GatewayProperties properties, ObjectMapper objectMapper) {
        this(properties, objectMapper, createRestTemplate(properties));
    }

    HttpRpcTransport(GatewayProperties properties, ObjectMapper objectMapper, RestTemplate restTemplate) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.restTemplate = restTemplate;

        log.info("Platform transport initialized: sandbox={}, live={}, connectTimeout={}, readTimeout={}",
            properties.getEndpoints().getSandbox(), properties.getEndpoints().getLive(),
            properties.getTimeouts().getConnect(), properties.getTimeouts().getRead());
    }

    @Override
    public RpcReply send(SignedRequest request) {
        String url = properties.endpoint(request.getLayer());

        log.debug("Dispatching platform call: layer={}, method={}, id={}",
            request.getLayer().wireName(), request.getMethod(), request.getRequestId());

        try {
            ResponseEntity<String> response = restTemplate.exchange(
                url,
                HttpMethod.POST,
                new HttpEntity<>(request.getBody(), createHeaders(request)),
                String.class
            );
            return reply(response.getStatusCode().value(), response.getBody());

        } catch (HttpStatusCodeException e) {
            return reply(e.getStatusCode().value(), e.getResponseBodyAsString(StandardCharsets.UTF_8));

        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new RpcTimeoutException("No reply from " + url + " within "
                    + properties.getTimeouts().getRead().toMillis() + " ms", e);
            }
            throw new RpcTransportException("Platform unreachable: " + e.getMessage(), e);
        }
    }

    private RpcReply reply(int status, String rawBody) {
        return new RpcReply(status, parse(rawBody), rawBody);
    }

    private JsonNode parse(String rawBody) {
        if (rawBody == null || rawBody.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(rawBody);
        } catch (JsonProcessingException e) {
            log.debug("Platform reply is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private HttpHeaders createHeaders(SignedRequest request) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("sign-data", request.getSignature());
        headers.set("sign-thumbprint", request.getKeyFingerprint());
        headers.set("sign-system", request.getSignerId());
        return headers;
    }

    private static RestTemplate createRestTemplate(GatewayProperties properties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) properties.getTimeouts().getConnect().toMillis());
        factory.setReadTimeout((int) properties.getTimeouts().getRead().toMillis());
        return new RestTemplate(factory);
    }
}
