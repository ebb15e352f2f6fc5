package com.curvemarket.settlement;

import com.curvemarket.domain.model.LeveragedPosition;
import java.math.BigInteger;

/**
 * Settlement of a leveraged position at the frozen price. External units.
 *
 * @param gross     value of the shares at the settlement price, zero on the losing side
 * @param shortfall debt the gross value does not cover
 * @param net       what is left for the holder once the loan is repaid
 * @param bonus     tier bonus paid on top of {@code net}
 */
public record PositionClaim(
        LeveragedPosition position,
        BigInteger gross,
        BigInteger principal,
        BigInteger interest,
        BigInteger shortfall,
        BigInteger net,
        BigInteger bonus) {

    public BigInteger payout() {
        return net.add(bonus);
    }
}
