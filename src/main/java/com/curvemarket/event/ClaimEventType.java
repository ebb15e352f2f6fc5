package com.curvemarket.event;

public enum ClaimEventType {

    /** The holder (or the authority on their behalf) redeemed a winning holding. */
    CLAIMED,

    /** An unclaimed holding was swept to insurance after the cooling-off period. */
    SWEPT
}
