package com.curvemarket.position;

import com.curvemarket.amm.AmmTrade;
import com.curvemarket.domain.model.LeveragedPosition;
import java.math.BigInteger;

/**
 * Outcome of unwinding a position through the AMM. External units except inside {@code trade}.
 *
 * @param position  the position as it was before it was closed
 * @param proceeds  stable received for the shares
 * @param shortfall debt not covered by proceeds, to be taken from insurance
 * @param surplus   proceeds left once principal and interest are repaid
 */
public record PositionSettlement(
        LeveragedPosition position,
        AmmTrade trade,
        BigInteger proceeds,
        BigInteger principal,
        BigInteger interest,
        BigInteger shortfall,
        BigInteger surplus) {

    public BigInteger debt() {
        return principal.add(interest);
    }

    /** Surplus returned minus collateral posted. */
    public BigInteger pnl() {
        return surplus.subtract(position.getCollateral());
    }
}
