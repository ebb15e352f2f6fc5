package com.curvemarket.exception;

/** Coarse grouping of error codes, reported to API clients next to the code itself. */
public enum ErrorCategory {
    REQUEST,
    LIFECYCLE,
    VALIDATION,
    GUARD,
    SOLVENCY,
    INTERNAL
}
