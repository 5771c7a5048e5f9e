package com.payoutengine.credentials;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for encrypted signing credentials, one row per layer.
 */
@Repository
public interface StoredCredentialRepository extends JpaRepository<StoredCredential, Layer> {
}
