package com.payoutengine.common.exception;

/**
 * Thrown when a beneficiary is not registered locally.
 */
public class BeneficiaryNotFoundException extends PayoutEngineException {

    public BeneficiaryNotFoundException(String beneficiaryId) {
        super("Beneficiary not found: " + beneficiaryId);
    }
}
