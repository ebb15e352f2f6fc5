package com.curvemarket.event;

/** Classifies the change that triggered a {@link PositionEvent}. */
public enum PositionEventType {

    /** A loan was drawn from the lending pool for a new position. */
    LEVERAGE_ACTIVATED,

    /** Shares were bought through the AMM and the position recorded. */
    OPENED,

    /** The trader closed the position and the loan was repaid. */
    CLOSED,

    /** A keeper liquidated an unhealthy position. */
    LIQUIDATED
}
