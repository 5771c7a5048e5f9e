package com.payoutengine.gateway;

import com.payoutengine.credentials.Layer;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration for the platform gateway.
 */
@Getter
@Setter
@ToString
@Validated
@ConfigurationProperties(prefix = "payout-engine.gateway")
public class GatewayProperties {

    @Valid
    private Endpoints endpoints = new Endpoints();

    @Valid
    private Timeouts timeouts = new Timeouts();

    /** Rate-limited list methods (list_virtual_account, list_beneficiary, ...). */
    @Valid
    private RateLimit listing = new RateLimit();

    /** Rate-limited lookups by id (get_virtual_account, get_beneficiary, get_payment). */
    @Valid
    private RateLimit lookup = new RateLimit();

    /** Minimum spacing of identical mutating calls. Zero disables it. */
    @NotNull
    private Duration mutationMinInterval = Duration.ZERO;

    /** How often expired cache entries are purged. */
    @NotNull
    private Duration cachePurgeInterval = Duration.ofMinutes(5);

    public String endpoint(Layer layer) {
        return layer == Layer.LIVE ? endpoints.getLive() : endpoints.getSandbox();
    }

    @Getter @Setter
    @ToString
    @Validated
    public static class Endpoints {
        @NotBlank
        private String sandbox = "https://pre.tochka.com/api/v1/cyclops/v2/jsonrpc";
        @NotBlank
        private String live = "https://api.tochka.com/api/v1/cyclops/v2/jsonrpc";
    }

    @Getter @Setter
    @ToString
    @Validated
    public static class Timeouts {
        /** TCP connect timeout. */
        @NotNull
        private Duration connect = Duration.ofSeconds(3);
        /** Read timeout; the call is abandoned once it elapses. */
        @NotNull
        private Duration read = Duration.ofSeconds(8);
    }

    @Getter @Setter
    @ToString
    @Validated
    public static class RateLimit {
        /** How long a successful result is served from the cache. */
        @NotNull
        private Duration ttl = Duration.ofMinutes(5);
        /** Smallest spacing between two dispatches of the same call. */
        @NotNull
        private Duration minInterval = Duration.ofMinutes(5);
    }
}
