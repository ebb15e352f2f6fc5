package com.curvemarket.domain.enums;

/** Which holding a settlement claim redeems. */
public enum ClaimKind {

    /** Non-transferable outcome tokens bought on the bonding curve. */
    OUTCOME_TOKENS,

    /** A leveraged AMM position opened after migration. */
    LEVERAGED_POSITION
}
