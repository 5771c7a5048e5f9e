package com.payoutengine.api.controller;

import com.payoutengine.api.dto.GatewayCallRequest;
import com.payoutengine.credentials.Layer;
import com.payoutengine.gateway.CacheStats;
import com.payoutengine.gateway.CallOptions;
import com.payoutengine.gateway.ErrorKind;
import com.payoutengine.gateway.Gateway;
import com.payoutengine.gateway.GatewayResponse;
import com.payoutengine.gateway.MethodCatalog;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Set;
import java.util.TreeSet;

/**
 * REST API for raw platform calls.
 */
@RestController
@RequestMapping("/api/v1/gateway")
@RequiredArgsConstructor
@Tag(name = "Gateway", description = "Signed, cached platform calls")
public class GatewayController {

    private final Gateway gateway;
    private final MethodCatalog catalog;

    @PostMapping("/call")
    @Operation(summary = "Call a platform method", description = "Returns {result, error, _cache}")
    public ResponseEntity<GatewayResponse> call(@Valid @RequestBody GatewayCallRequest request) {
        Layer layer = Layer.parse(request.getLayer());
        GatewayResponse response = gateway.call(layer, request.getMethod(), request.getParams(),
            request.isForce() ? CallOptions.forceRefresh() : CallOptions.DEFAULT);
        return ResponseEntity.status(statusOf(response)).body(response);
    }

    @GetMapping("/methods")
    @Operation(summary = "List allowed platform methods")
    public ResponseEntity<Set<String>> methods() {
        return ResponseEntity.ok(new TreeSet<>(catalog.methods()));
    }

    @GetMapping("/cache/stats")
    @Operation(summary = "Response cache statistics")
    public ResponseEntity<CacheStats> cacheStats() {
        return ResponseEntity.ok(gateway.cacheStats());
    }

    static HttpStatus statusOf(GatewayResponse response) {
        if (response.isSuccess()) {
            return HttpStatus.OK;
        }
        ErrorKind kind = response.getError().getKind();
        switch (kind) {
            case VALIDATION:
                return HttpStatus.BAD_REQUEST;
            case SIGNING:
                return HttpStatus.PRECONDITION_FAILED;
            case RATE_LIMIT_DEFERRED:
                return HttpStatus.TOO_MANY_REQUESTS;
            case DUPLICATE_SUBMISSION:
                return HttpStatus.CONFLICT;
            case TIMEOUT:
                return HttpStatus.GATEWAY_TIMEOUT;
            default:
                return HttpStatus.BAD_GATEWAY;
        }
    }
}
