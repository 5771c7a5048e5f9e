package com.payoutengine.credentials;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Encrypted signing credential of one layer.
 *
 * The private key, signer id and fingerprint are stored together in
 * {@code encryptedPayload}. The signer id and fingerprint are repeated in
 * clear so the console can show which key is configured without decrypting.
 */
@Entity
@Table(name = "signing_credentials")
@Data
@NoArgsConstructor
public class StoredCredential {

    @Id
    @Enumerated(EnumType.STRING)
    @Column(name = "layer", length = 16)
    private Layer layer;

    @ToString.Exclude
    @Lob
    @Column(name = "encrypted_payload", nullable = false)
    private String encryptedPayload;

    @Column(name = "signer_id", nullable = false)
    private String signerId;

    @Column(name = "key_fingerprint", nullable = false)
    private String keyFingerprint;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "updated_by")
    private String updatedBy;

    public StoredCredential(Layer layer, String encryptedPayload, String signerId,
                            String keyFingerprint, Instant updatedAt, String updatedBy) {
        this.layer = layer;
        this.encryptedPayload = encryptedPayload;
        this.signerId = signerId;
        this.keyFingerprint = keyFingerprint;
        this.updatedAt = updatedAt;
        this.updatedBy = updatedBy;
    }
}
