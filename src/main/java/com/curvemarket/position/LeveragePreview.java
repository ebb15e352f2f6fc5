package com.curvemarket.position;

import com.curvemarket.domain.enums.OutcomeSide;
import java.math.BigInteger;

/** What opening a position would produce at current reserves. Nothing is traded. */
public record LeveragePreview(
        OutcomeSide side,
        BigInteger collateral,
        int leverage,
        BigInteger notional,
        BigInteger loanAmount,
        BigInteger expectedShares,
        BigInteger entryPrice,
        BigInteger healthFactor) {}
