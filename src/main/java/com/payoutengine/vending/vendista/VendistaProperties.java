package com.payoutengine.vending.vendista;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration for the Vendista terminal API.
 */
@Getter
@Setter
@ToString
@Validated
@ConfigurationProperties(prefix = "payout-engine.vendista")
public class VendistaProperties {

    @NotBlank
    private String baseUrl = "https://api.vendista.ru:99";

    /** Bearer token. Revenue cannot be fetched without it. */
    @ToString.Exclude
    private String apiKey;

    @NotNull
    private Duration timeout = Duration.ofSeconds(30);

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
