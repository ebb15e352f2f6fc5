package com.curvemarket.curve;

import java.math.BigInteger;

/**
 * Price of a bonding-curve purchase. All amounts in accounting units.
 *
 * @param requestedShares  shares the buyer asked for
 * @param shares           shares actually sold, lower than requested when the purchase was capped
 * @param rawCost          curve capital the purchase adds
 * @param fee              protocol fee on top of {@code rawCost}
 * @param capped           whether the request was cut to stop at the migration threshold
 * @param reachesThreshold whether the purchase completes the curve and triggers migration
 */
public record CurveQuote(
        BigInteger requestedShares,
        BigInteger shares,
        BigInteger rawCost,
        BigInteger fee,
        boolean capped,
        boolean reachesThreshold) {

    public BigInteger totalCost() {
        return rawCost.add(fee);
    }
}
