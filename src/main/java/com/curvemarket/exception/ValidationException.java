package com.curvemarket.exception;

import java.util.Map;

/** Raised for malformed inputs: zero amounts, bad addresses, out-of-range leverage. */
public class ValidationException extends BaseException {

    public ValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public ValidationException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }
}
