package com.curvemarket.exception;

import java.util.Map;

/** Raised when a safety guard rejects the call (signatures, slippage, re-entrancy, cooling-off). */
public class GuardViolationException extends BaseException {

    public GuardViolationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public GuardViolationException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }
}
