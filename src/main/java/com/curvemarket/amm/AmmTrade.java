package com.curvemarket.amm;

import com.curvemarket.domain.enums.OutcomeSide;
import java.math.BigInteger;

/**
 * Result of one AMM swap, in accounting units. Prices are read after the complementary
 * reserve has been rebalanced.
 */
public record AmmTrade(
        OutcomeSide side,
        BigInteger amountIn,
        BigInteger amountOut,
        BigInteger priceYes,
        BigInteger priceNo,
        boolean clamped) {}
