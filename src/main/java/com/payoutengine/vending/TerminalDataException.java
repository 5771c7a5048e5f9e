package com.payoutengine.vending;

import com.payoutengine.common.exception.PayoutEngineException;

public class TerminalDataException extends PayoutEngineException {

    public TerminalDataException(String message) {
        super(message);
    }

    public TerminalDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
