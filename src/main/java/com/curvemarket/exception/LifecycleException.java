package com.curvemarket.exception;

import java.util.Map;

/** Raised when an operation is not allowed in the market's current phase or position state. */
public class LifecycleException extends BaseException {

    public LifecycleException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public LifecycleException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }
}
