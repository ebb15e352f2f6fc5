package com.curvemarket.domain.enums;

/**
 * Lifecycle phase of the market. Phases only ever move forward.
 *
 * <p>A market may skip {@link #PHASE2_ACTIVE} entirely when it is resolved before the
 * bonding curve reaches its migration threshold.
 */
public enum MarketPhase {

    /** Bonding-curve sale is open; no AMM reserves exist yet. */
    PRE_MIGRATION,

    /** Curve capital has seeded the virtual AMM; leveraged positions may be opened. */
    PHASE2_ACTIVE,

    /** Outcome fixed and settlement price frozen; only claims and sweeps remain. */
    RESOLVED
}
