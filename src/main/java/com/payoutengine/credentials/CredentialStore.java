package com.payoutengine.credentials;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payoutengine.common.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the active signing credential of each layer.
 *
 * Credentials are changed only through {@link #install} and {@link #remove}.
 * A new key is fully validated and persisted before it replaces the active
 * one; if any step fails the previous credential stays in effect.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CredentialStore implements CredentialProvider {

    private final StoredCredentialRepository repository;
    private final CredentialProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<Layer, Credential> active = new ConcurrentHashMap<>();

    @Override
    public Optional<Credential> find(Layer layer) {
        Credential credential = active.get(layer);
        if (credential != null) {
            return Optional.of(credential);
        }
        return Optional.ofNullable(active.computeIfAbsent(layer, this::load));
    }

    /**
     * Validate, encrypt, persist and then activate a signing credential.
     *
     * @param fingerprint explicit key fingerprint; derived from the key when blank
     * @throws ValidationException if the key or signer id is invalid
     */
    public CredentialStatus install(Layer layer, String privateKeyPem, String signerId,
                                    String fingerprint, String updatedBy) {
        if (layer == null) {
            throw new ValidationException("Layer is required");
        }
        if (signerId == null || signerId.isBlank()) {
            throw new ValidationException("Signer id (sign-system) is required");
        }

        KeyMaterial.ValidatedKey key = KeyMaterial.validate(privateKeyPem, properties.getMinKeyBits());

        String effectiveFingerprint = fingerprint != null && !fingerprint.isBlank()
            ? fingerprint.trim().toLowerCase(Locale.ROOT)
            : key.getFingerprint();
        if (effectiveFingerprint == null) {
            throw new ValidationException("Key fingerprint (sign-thumbprint) is required for this key");
        }

        Instant now = clock.instant();
        String encrypted = CredentialCipher.encrypt(
            serialize(privateKeyPem, signerId.trim(), effectiveFingerprint),
            properties.getMasterPassword());

        repository.save(new StoredCredential(layer, encrypted, signerId.trim(), effectiveFingerprint, now, updatedBy));

        Credential credential = new Credential(layer, key.getPrivateKey(), signerId.trim(), effectiveFingerprint, now);
        active.put(layer, credential);

        log.info("Signing credential installed: layer={}, signerId={}, fingerprint={}, bits={}",
            layer.wireName(), credential.getSignerId(), preview(effectiveFingerprint), key.getModulusBits());

        return status(layer);
    }

    /**
     * Delete a layer's credential. Signing on that layer fails afterwards.
     *
     * @return true if a credential existed
     */
    public boolean remove(Layer layer) {
        boolean existed = repository.existsById(layer);
        if (existed) {
            repository.deleteById(layer);
        }
        active.remove(layer);
        log.info("Signing credential removed: layer={}, existed={}", layer.wireName(), existed);
        return existed;
    }

    public CredentialStatus status(Layer layer) {
        return repository.findById(layer)
            .map(stored -> CredentialStatus.builder()
                .layer(layer)
                .configured(true)
                .signerId(stored.getSignerId())
                .fingerprintPreview(preview(stored.getKeyFingerprint()))
                .updatedAt(stored.getUpdatedAt())
                .build())
            .orElseGet(() -> CredentialStatus.notConfigured(layer));
    }

    private Credential load(Layer layer) {
        Optional<StoredCredential> stored = repository.findById(layer);
        if (stored.isEmpty()) {
            return null;
        }

        JsonNode payload = deserialize(CredentialCipher.decrypt(
            stored.get().getEncryptedPayload(), properties.getMasterPassword()));
        KeyMaterial.ValidatedKey key = KeyMaterial.validate(payload.path("privateKey").asText(), properties.getMinKeyBits());

        log.debug("Signing credential loaded: layer={}", layer.wireName());
        return new Credential(layer, key.getPrivateKey(),
            payload.path("signSystem").asText(),
            payload.path("signThumbprint").asText(),
            stored.get().getUpdatedAt());
    }

    private String serialize(String privateKeyPem, String signerId, String fingerprint) {
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("privateKey", privateKeyPem);
        payload.put("signSystem", signerId);
        payload.put("signThumbprint", fingerprint);
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new CredentialStorageException("Failed to serialize credential", e);
        }
    }

    private JsonNode deserialize(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new CredentialStorageException("Stored credential is corrupt", e);
        }
    }

    private static String preview(String fingerprint) {
        return fingerprint.length() > 8 ? fingerprint.substring(0, 8) + "..." : fingerprint;
    }
}
