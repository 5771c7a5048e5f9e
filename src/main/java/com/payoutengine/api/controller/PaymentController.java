package com.payoutengine.api.controller;

import com.payoutengine.api.dto.IdentifyPaymentRequest;
import com.payoutengine.credentials.Layer;
import com.payoutengine.gateway.GatewayResponse;
import com.payoutengine.platform.PlatformClient;
import com.payoutengine.platform.PlatformDTOs;
import com.payoutengine.platform.PlatformResponseException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for incoming payments on the nominal account.
 */
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
@Tag(name = "Payments", description = "Incoming payments and their identification")
public class PaymentController {

    private final PlatformClient platformClient;

    @GetMapping
    @Operation(summary = "List incoming payments", description = "Returns {result, error, _cache}")
    public ResponseEntity<GatewayResponse> list(@RequestParam String layer,
                                                @RequestParam(required = false) String type,
                                                @RequestParam(required = false) Boolean identified,
                                                @RequestParam(required = false) String dateFrom,
                                                @RequestParam(required = false) String dateTo) {
        PlatformDTOs.PaymentFilter filter = new PlatformDTOs.PaymentFilter(type, identified, dateFrom, dateTo);
        GatewayResponse response = platformClient.listPayments(Layer.parse(layer), filter);
        return ResponseEntity.status(GatewayController.statusOf(response)).body(response);
    }

    @GetMapping("/{paymentId}")
    @Operation(summary = "Get an incoming payment")
    public ResponseEntity<PlatformDTOs.Payment> get(@PathVariable String paymentId, @RequestParam String layer) {
        GatewayResponse response = platformClient.getPayment(Layer.parse(layer), paymentId);
        response.orThrow();
        PlatformDTOs.Payment payment = platformClient.readPayment(response)
            .orElseThrow(() -> new PlatformResponseException("Empty result for payment " + paymentId));
        return ResponseEntity.ok(payment);
    }

    @PostMapping("/{paymentId}/identify")
    @Operation(summary = "Identify a payment", description = "Credits the payment to the given virtual accounts")
    public ResponseEntity<GatewayResponse> identify(@PathVariable String paymentId,
                                                    @Valid @RequestBody IdentifyPaymentRequest request) {
        GatewayResponse response = platformClient.identifyPayment(Layer.parse(request.getLayer()), paymentId,
            request.getOwners());
        return ResponseEntity.status(GatewayController.statusOf(response)).body(response);
    }
}
