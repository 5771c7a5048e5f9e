package com.payoutengine.api.controller;

import com.payoutengine.credentials.Layer;
import com.payoutengine.gateway.CallOptions;
import com.payoutengine.gateway.GatewayResponse;
import com.payoutengine.platform.PlatformClient;
import com.payoutengine.platform.PlatformDTOs;
import com.payoutengine.platform.PlatformResponseException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/virtual-accounts")
@RequiredArgsConstructor
@Tag(name = "Virtual accounts", description = "Balances of platform virtual accounts")
public class VirtualAccountController {

    private final PlatformClient platformClient;

    @GetMapping("/{virtualAccount}")
    @Operation(summary = "Get a virtual account with its balance")
    public ResponseEntity<PlatformDTOs.VirtualAccount> get(@PathVariable String virtualAccount,
                                                           @RequestParam String layer,
                                                           @RequestParam(defaultValue = "false") boolean force) {
        GatewayResponse response = platformClient.getVirtualAccount(Layer.parse(layer), virtualAccount,
            force ? CallOptions.forceRefresh() : CallOptions.DEFAULT);
        response.orThrow();
        PlatformDTOs.VirtualAccount account = platformClient.readVirtualAccount(response)
            .orElseThrow(() -> new PlatformResponseException("Empty result for virtual account " + virtualAccount));
        return ResponseEntity.ok(account);
    }
}
