package com.curvemarket.amm;

import com.curvemarket.domain.enums.OutcomeSide;
import com.curvemarket.domain.model.MarketState;
import com.curvemarket.exception.ErrorCode;
import com.curvemarket.exception.ValidationException;
import com.curvemarket.math.MarketMath;
import com.curvemarket.math.MarketMath.ConstantProductResult;
import com.curvemarket.state.MarketStateStore;
import java.math.BigInteger;
import org.springframework.stereotype.Component;

/**
 * Phase-2 virtual AMM: one stable reserve shared by a YES and a NO reserve.
 *
 * <p>At migration the curve capital becomes the stable reserve and each side is seeded with
 * twice that amount, so both sides start at a price of 0.5. A trade swaps stable against the
 * traded side using that pair's current product {@code reserveStable * reserveSide}. For a
 * side untouched by rebalancing this is the invariant recorded at migration.
 *
 * <p>After every trade the complementary reserve is recomputed so that
 * {@code priceYes + priceNo} stays at 1, up to rounding. When the traded side's price ends
 * above the configured ceiling, the other side is priced off the ceiling instead, which keeps
 * its price at or above {@code 1 - ceiling}. The traded reserve keeps the value its trade
 * produced, so while clamped the two prices sum to more than 1.
 */
@Component
public class VirtualAmm {

    private final MarketStateStore store;

    public VirtualAmm(MarketStateStore store) {
        this.store = store;
    }

    public void seed(BigInteger capitalRaised) {
        MarketState state = store.state();
        BigInteger sideReserve = capitalRaised.multiply(BigInteger.TWO);
        state.setReserveStable(capitalRaised);
        state.setReserveYes(sideReserve);
        state.setReserveNo(sideReserve);
        state.setInvariantK(capitalRaised.multiply(sideReserve));
    }

    /** Raw WAD price of a side: {@code reserveStable / reserveSide}. */
    public BigInteger priceOf(OutcomeSide side) {
        MarketState state = store.state();
        return MarketMath.price(state.getReserveStable(), state.reserveOf(side));
    }

    /** Shares a buy of {@code stableIn} would return, without trading. */
    public BigInteger previewBuy(OutcomeSide side, BigInteger stableIn) {
        MarketState state = store.state();
        return MarketMath.buyShares(state.getReserveStable(), state.reserveOf(side), stableIn)
                .amountOut();
    }

    public AmmTrade buy(OutcomeSide side, BigInteger stableIn) {
        if (stableIn.signum() <= 0) {
            throw new ValidationException(ErrorCode.ZERO_AMOUNT, "Stable amount must be positive");
        }
        MarketState state = store.state();
        ConstantProductResult result = MarketMath.buyShares(state.getReserveStable(), state.reserveOf(side), stableIn);
        if (result.amountOut().signum() == 0) {
            throw new ValidationException(ErrorCode.ZERO_SHARES_OUT, "Buying " + side + " with " + stableIn + " returns no shares");
        }
        state.setReserveStable(result.reserveStable());
        state.setReserve(side, result.reserveSide());
        boolean clamped = rebalance(side);
        return new AmmTrade(side, stableIn, result.amountOut(), priceOf(OutcomeSide.YES), priceOf(OutcomeSide.NO), clamped);
    }

    public AmmTrade sell(OutcomeSide side, BigInteger sharesIn) {
        if (sharesIn.signum() <= 0) {
            throw new ValidationException(ErrorCode.ZERO_AMOUNT, "Share amount must be positive");
        }
        MarketState state = store.state();
        ConstantProductResult result = MarketMath.sellShares(state.getReserveStable(), state.reserveOf(side), sharesIn);
        if (result.amountOut().signum() == 0) {
            throw new ValidationException(ErrorCode.ZERO_STABLE_OUT, "Selling " + sharesIn + " " + side + " returns no stable");
        }
        state.setReserveStable(result.reserveStable());
        state.setReserve(side, result.reserveSide());
        boolean clamped = rebalance(side);
        return new AmmTrade(side, sharesIn, result.amountOut(), priceOf(OutcomeSide.YES), priceOf(OutcomeSide.NO), clamped);
    }

    /** Recomputes the complementary reserve. Returns whether the ceiling applied. */
    private boolean rebalance(OutcomeSide tradedSide) {
        MarketState state = store.state();
        BigInteger ceiling = store.parameters().getPriceCeiling();
        BigInteger tradedPrice = MarketMath.price(state.getReserveStable(), state.reserveOf(tradedSide));
        boolean clamped = tradedPrice.compareTo(ceiling) > 0;
        if (clamped) {
            tradedPrice = ceiling;
        }
        BigInteger otherPrice = MarketMath.WAD.subtract(tradedPrice);
        state.setReserve(tradedSide.opposite(), state.getReserveStable().multiply(MarketMath.WAD).divide(otherPrice));
        return clamped;
    }
}
