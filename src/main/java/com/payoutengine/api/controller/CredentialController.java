package com.payoutengine.api.controller;

import com.payoutengine.api.dto.InstallCredentialRequest;
import com.payoutengine.credentials.CredentialProperties;
import com.payoutengine.credentials.CredentialStatus;
import com.payoutengine.credentials.CredentialStore;
import com.payoutengine.credentials.KeyMaterial;
import com.payoutengine.credentials.Layer;
import com.payoutengine.gateway.GatewayResponse;
import com.payoutengine.platform.PlatformClient;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * REST API for signing credentials. Private keys are accepted but never returned.
 */
@RestController
@RequestMapping("/api/v1/credentials")
@RequiredArgsConstructor
@Tag(name = "Credentials", description = "Per-layer signing keys")
public class CredentialController {

    private final CredentialStore credentialStore;
    private final CredentialProperties properties;
    private final PlatformClient platformClient;

    @GetMapping("/status")
    @Operation(summary = "Credential status of every layer")
    public ResponseEntity<List<CredentialStatus>> status() {
        return ResponseEntity.ok(Arrays.stream(Layer.values()).map(credentialStore::status).collect(Collectors.toList()));
    }

    @PutMapping("/{layer}")
    @Operation(summary = "Install or replace a layer's signing key")
    public ResponseEntity<CredentialStatus> install(@PathVariable String layer,
                                                    @Valid @RequestBody InstallCredentialRequest request) {
        CredentialStatus status = credentialStore.install(Layer.parse(layer), request.getPrivateKey(),
            request.getSignerId(), request.getKeyFingerprint(), request.getUpdatedBy());
        return ResponseEntity.ok(status);
    }

    @DeleteMapping("/{layer}")
    @Operation(summary = "Remove a layer's signing key")
    public ResponseEntity<Void> remove(@PathVariable String layer) {
        boolean existed = credentialStore.remove(Layer.parse(layer));
        return existed ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    @PostMapping("/{layer}/test")
    @Operation(summary = "Send a signed echo to the platform")
    public ResponseEntity<GatewayResponse> test(@PathVariable String layer) {
        GatewayResponse response = platformClient.echo(Layer.parse(layer), "ping");
        return ResponseEntity.status(GatewayController.statusOf(response)).body(response);
    }

    @PostMapping("/generate")
    @Operation(summary = "Generate a new RSA key pair",
        description = "The public key is registered with the platform; the private key is installed afterwards")
    public ResponseEntity<KeyMaterial.GeneratedKeyPair> generate() {
        return ResponseEntity.ok(KeyMaterial.generate(properties.getGeneratedKeyBits()));
    }
}
