package com.payoutengine.api.dto;

import lombok.Data;

@Data
public class ReconcileRequest {

    /**
     * Platform transfer id, when the payout does not know it yet.
     */
    private String transferId;
}
