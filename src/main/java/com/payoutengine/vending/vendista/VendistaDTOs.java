package com.payoutengine.vending.vendista;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * DTOs for the Vendista API.
 */
public class VendistaDTOs {

    /**
     * One sale. {@code date} is an ISO date-time; ids may be numbers or strings.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Transaction {
        private String id;
        @JsonProperty("machine_id")
        private String machineId;
        private String date;
        private BigDecimal amount;
        private String type;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TransactionPage {
        private List<Transaction> items = new ArrayList<>();
    }
}
