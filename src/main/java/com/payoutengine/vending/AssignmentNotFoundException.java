package com.payoutengine.vending;

import com.payoutengine.common.exception.PayoutEngineException;

public class AssignmentNotFoundException extends PayoutEngineException {

    public AssignmentNotFoundException(Long assignmentId) {
        super("Machine assignment not found: " + assignmentId);
    }
}
