package com.payoutengine.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.payoutengine.common.exception.ValidationException;
import com.payoutengine.credentials.Layer;
import com.payoutengine.signing.RequestSigner;
import com.payoutengine.signing.SignedRequest;
import com.payoutengine.signing.SigningException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Single entry point for platform calls.
 *
 * Call flow:
 * 1. Look the method up in the allow-list
 * 2. Serve a live cached result for reads (unless forced)
 * 3. Defer reads whose admission window is still closed
 * 4. Sign and dispatch with the fixed timeout
 * 5. Classify the reply, record the call, cache or invalidate
 *
 * Never throws for remote failures; the outcome is the {@link ErrorKind} of
 * the returned response.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Gateway {

    private final MethodCatalog catalog;
    private final ResponseCache cache;
    private final RequestSigner signer;
    private final RpcTransport transport;
    private final Clock clock;

    public GatewayResponse call(Layer layer, String method, Map<String, Object> params) {
        return call(layer, method, params, CallOptions.DEFAULT);
    }

    public GatewayResponse call(Layer layer, String method, Map<String, Object> params, CallOptions options) {
        if (layer == null) {
            return invalid(null, method, "Layer is required");
        }
        if (method == null || method.isBlank()) {
            return invalid(layer, method, "Method is required");
        }
        Optional<MethodPolicy> found = catalog.find(method);
        if (found.isEmpty()) {
            return invalid(layer, method, "Method \"" + method + "\" is not allowed");
        }
        MethodPolicy policy = found.get();
        Map<String, Object> effectiveParams = params == null ? Map.of() : params;

        String key;
        try {
            key = CacheKeys.of(layer, method, effectiveParams);
        } catch (ValidationException e) {
            return invalid(layer, method, e.getMessage());
        }

        if (policy.isRead()) {
            Optional<GatewayResponse> early = fromCacheOrDeferred(layer, method, key, options);
            if (early.isPresent()) {
                return early.get();
            }
        }

        SignedRequest request;
        try {
            request = signer.sign(layer, method, effectiveParams);
        } catch (SigningException e) {
            log.error("Platform call not signed: layer={}, method={}: {}", layer.wireName(), method, e.getMessage());
            return GatewayResponse.failure(layer, method, GatewayError.local(ErrorKind.SIGNING, e.getMessage()),
                CacheInfo.fresh(cache.nextAllowedAt(key).orElse(null)));
        }

        return dispatch(request, policy, key, effectiveParams);
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    private Optional<GatewayResponse> fromCacheOrDeferred(Layer layer, String method, String key, CallOptions options) {
        Instant now = clock.instant();

        if (!options.isForce()) {
            Optional<CacheEntry> live = cache.get(key);
            if (live.isPresent()) {
                log.debug("Cache hit: layer={}, method={}", layer.wireName(), method);
                return Optional.of(GatewayResponse.success(layer, method, live.get().getPayload(),
                    new CacheInfo(true, cache.nextAllowedAt(key).orElse(null), live.get().ageSeconds(now))));
            }
        }

        Admission admission = cache.admission(key);
        if (admission.isOpen()) {
            return Optional.empty();
        }

        Optional<CacheEntry> stale = cache.peek(key);
        log.info("Platform call deferred: layer={}, method={}, nextAllowedAt={}",
            layer.wireName(), method, admission.getNextAllowedAt());
        GatewayError error = GatewayError.local(ErrorKind.RATE_LIMIT_DEFERRED,
            "Rate limit window is closed until " + admission.getNextAllowedAt());
        CacheInfo info = new CacheInfo(stale.isPresent(), admission.getNextAllowedAt(),
            stale.map(entry -> entry.ageSeconds(now)).orElse(null));
        return Optional.of(new GatewayResponse(layer, method,
            stale.map(CacheEntry::getPayload).orElse(null), error, info));
    }

    private GatewayResponse dispatch(SignedRequest request, MethodPolicy policy, String key, Map<String, Object> params) {
        Layer layer = request.getLayer();
        String method = request.getMethod();
        long startedAt = clock.millis();

        RpcReply reply;
        try {
            reply = transport.send(request);
        } catch (RpcTimeoutException e) {
            Instant next = cache.recordCall(key, policy.getMinInterval());
            log.error("Platform call timed out: layer={}, method={}, id={}, params={}",
                layer.wireName(), method, request.getRequestId(), ParamMasker.mask(params));
            return GatewayResponse.failure(layer, method,
                GatewayError.local(ErrorKind.TIMEOUT, e.getMessage()), CacheInfo.fresh(next));
        } catch (RpcTransportException e) {
            Instant next = cache.recordCall(key, policy.getMinInterval());
            log.error("Platform call failed: layer={}, method={}, id={}", layer.wireName(), method,
                request.getRequestId(), e);
            return GatewayResponse.failure(layer, method,
                GatewayError.local(ErrorKind.REMOTE, e.getMessage()), CacheInfo.fresh(next));
        }

        Instant next = cache.recordCall(key, policy.getMinInterval());
        long durationMs = clock.millis() - startedAt;
        Optional<GatewayError> error = ResponseClassifier.errorOf(reply);

        if (error.isPresent()) {
            log.warn("Platform call rejected: layer={}, method={}, id={}, kind={}, code={}, message={}, params={}, durationMs={}",
                layer.wireName(), method, request.getRequestId(), error.get().getKind(), error.get().getCode(),
                error.get().getMessage(), ParamMasker.mask(params), durationMs);
            return GatewayResponse.failure(layer, method, error.get(), CacheInfo.fresh(next));
        }

        JsonNode result = reply.getBody().get("result");
        log.info("Platform call succeeded: layer={}, method={}, id={}, durationMs={}",
            layer.wireName(), method, request.getRequestId(), durationMs);

        if (policy.isCacheable()) {
            cache.put(key, result, policy.getCacheTtl());
        }
        for (String dependent : policy.getInvalidates()) {
            cache.invalidateMethod(layer, dependent);
        }

        return GatewayResponse.success(layer, method, result, CacheInfo.fresh(next));
    }

    private GatewayResponse invalid(Layer layer, String method, String message) {
        log.warn("Platform call rejected locally: layer={}, method={}: {}",
            layer != null ? layer.wireName() : null, method, message);
        return GatewayResponse.failure(layer, method, GatewayError.local(ErrorKind.VALIDATION, message),
            CacheInfo.fresh(null));
    }
}
