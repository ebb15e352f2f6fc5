package com.curvemarket.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Every failure reason the market reports, with its HTTP status and category. */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400, ErrorCategory.VALIDATION),
    BAD_REQUEST("BAD_REQUEST", 400, ErrorCategory.REQUEST),
    UNAUTHORIZED("UNAUTHORIZED", 401, ErrorCategory.GUARD),
    FORBIDDEN("FORBIDDEN", 403, ErrorCategory.GUARD),
    NOT_FOUND("NOT_FOUND", 404, ErrorCategory.REQUEST),
    INTERNAL_ERROR("INTERNAL_ERROR", 500, ErrorCategory.INTERNAL),

    ALREADY_INITIALIZED("ALREADY_INITIALIZED", 409, ErrorCategory.LIFECYCLE),
    NOT_INITIALIZED("NOT_INITIALIZED", 409, ErrorCategory.LIFECYCLE),
    MARKET_ALREADY_MIGRATED("MARKET_ALREADY_MIGRATED", 409, ErrorCategory.LIFECYCLE),
    MARKET_ALREADY_RESOLVED("MARKET_ALREADY_RESOLVED", 409, ErrorCategory.LIFECYCLE),
    MARKET_NOT_RESOLVED("MARKET_NOT_RESOLVED", 409, ErrorCategory.LIFECYCLE),
    PHASE2_NOT_ACTIVE("PHASE2_NOT_ACTIVE", 409, ErrorCategory.LIFECYCLE),
    POSITION_ALREADY_ACTIVE("POSITION_ALREADY_ACTIVE", 409, ErrorCategory.LIFECYCLE),
    NO_ACTIVE_POSITION("NO_ACTIVE_POSITION", 409, ErrorCategory.LIFECYCLE),
    NO_WINNING_POSITION("NO_WINNING_POSITION", 409, ErrorCategory.LIFECYCLE),
    NOTHING_TO_CLAIM("NOTHING_TO_CLAIM", 409, ErrorCategory.LIFECYCLE),

    ZERO_AMOUNT("ZERO_AMOUNT", 400, ErrorCategory.VALIDATION),
    INVALID_ADDRESS("INVALID_ADDRESS", 400, ErrorCategory.VALIDATION),
    COLLATERAL_BELOW_MINIMUM("COLLATERAL_BELOW_MINIMUM", 400, ErrorCategory.VALIDATION),
    LEVERAGE_OUT_OF_BOUNDS("LEVERAGE_OUT_OF_BOUNDS", 400, ErrorCategory.VALIDATION),
    ARRAY_LENGTH_MISMATCH("ARRAY_LENGTH_MISMATCH", 400, ErrorCategory.VALIDATION),
    ZERO_SHARES_OUT("ZERO_SHARES_OUT", 422, ErrorCategory.VALIDATION),
    ZERO_STABLE_OUT("ZERO_STABLE_OUT", 422, ErrorCategory.VALIDATION),

    SLIPPAGE_EXCEEDED("SLIPPAGE_EXCEEDED", 422, ErrorCategory.GUARD),
    INVALID_SIGNATURE("INVALID_SIGNATURE", 401, ErrorCategory.GUARD),
    SIGNATURE_EXPIRED("SIGNATURE_EXPIRED", 401, ErrorCategory.GUARD),
    POSITION_HEALTHY("POSITION_HEALTHY", 422, ErrorCategory.GUARD),
    COOLING_OFF_ACTIVE("COOLING_OFF_ACTIVE", 422, ErrorCategory.GUARD),
    REENTRANT_CALL("REENTRANT_CALL", 409, ErrorCategory.GUARD),
    TRANSFER_DISABLED("TRANSFER_DISABLED", 422, ErrorCategory.GUARD),

    INSUFFICIENT_INSURANCE_FUNDS("INSUFFICIENT_INSURANCE_FUNDS", 422, ErrorCategory.SOLVENCY),
    INSUFFICIENT_LIQUIDITY("INSUFFICIENT_LIQUIDITY", 422, ErrorCategory.SOLVENCY),
    INSUFFICIENT_BALANCE("INSUFFICIENT_BALANCE", 422, ErrorCategory.SOLVENCY),
    LOAN_CAP_EXCEEDED("LOAN_CAP_EXCEEDED", 422, ErrorCategory.SOLVENCY);

    private final String code;
    private final int httpStatus;
    private final ErrorCategory category;
}
