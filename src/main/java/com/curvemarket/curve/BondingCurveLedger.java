package com.curvemarket.curve;

import com.curvemarket.domain.model.MarketParameters;
import com.curvemarket.domain.model.MarketState;
import com.curvemarket.exception.ErrorCode;
import com.curvemarket.exception.ValidationException;
import com.curvemarket.math.MarketMath;
import com.curvemarket.state.MarketStateStore;
import java.math.BigInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Phase-1 price discovery on a linear bonding curve.
 *
 * <p>The marginal price is {@code K * supply / SCALE}, so buying from supply {@code s} to
 * {@code e} costs {@code K * (e^2 - s^2) / (2 * SCALE^2)}. YES and NO share one supply: a
 * purchase on either side moves the same curve.
 *
 * <p>A purchase that would push the raised capital past the migration threshold is cut to
 * the largest share amount that fits. When the capital still missing after the cut is within
 * the dust tolerance, or is less than one more share would cost, the purchase is charged
 * exactly that gap so the threshold is hit precisely and migration happens. The raised capital
 * therefore never exceeds the threshold, and the purchase that first reaches it migrates.
 */
@Component
public class BondingCurveLedger {

    private static final Logger log = LoggerFactory.getLogger(BondingCurveLedger.class);

    private final MarketStateStore store;

    public BondingCurveLedger(MarketStateStore store) {
        this.store = store;
    }

    public BigInteger spotPrice() {
        MarketParameters parameters = store.parameters();
        return MarketMath.curveSpotPrice(
                parameters.getCurveSlope(), parameters.getCurveScale(), store.state().getCurrentSupply());
    }

    /** Prices a purchase without changing any state. */
    public CurveQuote quote(BigInteger requestedShares) {
        if (requestedShares == null || requestedShares.signum() <= 0) {
            throw new ValidationException(ErrorCode.ZERO_AMOUNT, "Share amount must be positive");
        }
        MarketParameters parameters = store.parameters();
        MarketState state = store.state();
        BigInteger slope = parameters.getCurveSlope();
        BigInteger scale = parameters.getCurveScale();
        BigInteger supply = state.getCurrentSupply();
        BigInteger raised = state.getTotalCapitalRaised();
        BigInteger threshold = parameters.migrationThresholdAccounting();

        BigInteger shares = requestedShares;
        BigInteger rawCost = MarketMath.curveCost(slope, scale, supply, supply.add(shares));
        boolean capped = false;

        if (raised.add(rawCost).compareTo(threshold) > 0) {
            BigInteger gap = threshold.subtract(raised);
            shares = MarketMath.curveSharesForCapital(slope, scale, supply, gap);
            rawCost = MarketMath.curveCost(slope, scale, supply, supply.add(shares));
            BigInteger nextShareCost = MarketMath.curveCost(slope, scale, supply, supply.add(shares).add(BigInteger.ONE));
            // A gap the next share cannot fit into can only be closed by this purchase.
            if (gap.subtract(rawCost).compareTo(parameters.getDustTolerance()) <= 0
                    || nextShareCost.compareTo(gap) >= 0) {
                rawCost = gap;
            }
            capped = true;
            log.debug("Curve purchase capped from {} to {} shares, gap {}", requestedShares, shares, gap);
        }

        if (rawCost.signum() == 0) {
            throw new ValidationException(ErrorCode.ZERO_AMOUNT, "Purchase of " + shares + " shares costs nothing");
        }
        BigInteger fee = MarketMath.bps(rawCost, parameters.getCurveFeeBps());
        boolean reachesThreshold = raised.add(rawCost).compareTo(threshold) >= 0;
        return new CurveQuote(requestedShares, shares, rawCost, fee, capped, reachesThreshold);
    }

    /** Books a quoted purchase against the curve. */
    public void apply(CurveQuote quote) {
        MarketState state = store.state();
        state.setCurrentSupply(state.getCurrentSupply().add(quote.shares()));
        state.setTotalCapitalRaised(state.getTotalCapitalRaised().add(quote.rawCost()));
    }
}
