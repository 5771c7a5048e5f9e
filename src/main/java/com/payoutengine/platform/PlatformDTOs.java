package com.payoutengine.platform;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Parameters and results of the platform methods the engine calls itself.
 * Field names follow the platform's snake_case JSON-RPC structures.
 */
public class PlatformDTOs {

    /**
     * {@code transfer_between_virtual_accounts_v2} parameters.
     * {@code extKey} makes the transfer idempotent on the platform side.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TransferRequest {
        private String fromVirtualAccount;
        private String toVirtualAccount;
        private BigDecimal amount;
        private String purpose;
        private String extKey;

        public Map<String, Object> toParams() {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("from_virtual_account", fromVirtualAccount);
            params.put("to_virtual_account", toVirtualAccount);
            params.put("amount", amount);
            if (purpose != null) {
                params.put("purpose", purpose);
            }
            if (extKey != null) {
                params.put("ext_key", extKey);
            }
            return params;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TransferResult {
        @JsonProperty("transfer_id")
        private String transferId;
        private String status;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VirtualAccount {
        private String code;
        @JsonProperty("beneficiary_id")
        private String beneficiaryId;
        private String type;
        @JsonProperty("cash")
        private BigDecimal cash;
        @JsonProperty("blocked_cash")
        private BigDecimal blockedCash;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Payment {
        private String id;
        private BigDecimal amount;
        private String purpose;
        private String type;
        private String status;
        private boolean identify;
    }

    /**
     * Share of an incoming payment credited to one virtual account.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PaymentOwner {
        @NotBlank(message = "Virtual account is required")
        private String virtualAccount;

        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        private BigDecimal amount;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PaymentFilter {
        private String type;
        private Boolean identified;
        private String dateFrom;
        private String dateTo;

        public Map<String, Object> toParams() {
            Map<String, Object> params = new LinkedHashMap<>();
            if (type != null) {
                params.put("type", type);
            }
            if (identified != null) {
                params.put("identified", identified);
            }
            if (dateFrom != null) {
                params.put("date_from", dateFrom);
            }
            if (dateTo != null) {
                params.put("date_to", dateTo);
            }
            return params;
        }
    }

    static Map<String, Object> ownersParams(String paymentId, List<PaymentOwner> owners) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("payment_id", paymentId);
        params.put("owners", owners.stream()
            .map(owner -> Map.<String, Object>of("virtual_account", owner.getVirtualAccount(), "amount", owner.getAmount()))
            .collect(Collectors.toList()));
        return params;
    }
}
