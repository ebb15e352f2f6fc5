package com.curvemarket.exception;

import java.util.Map;

/** Raised when a collaborator cannot fund or absorb the money an operation needs. */
public class SolvencyException extends BaseException {

    public SolvencyException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public SolvencyException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }
}
