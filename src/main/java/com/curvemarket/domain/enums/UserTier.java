package com.curvemarket.domain.enums;

/**
 * Claimant tier used to scale the settlement bonus on winning leveraged positions.
 * The multiplier for each tier is configured, see {@code curvemarket.settlement.tier-*}.
 * The ordinal is part of the signed claim message and must not be reordered.
 */
public enum UserTier {
    STANDARD,
    EARLY,
    FAN_TOKEN
}
