package com.curvemarket.position;

import com.curvemarket.amm.AmmTrade;
import com.curvemarket.amm.VirtualAmm;
import com.curvemarket.domain.enums.OutcomeSide;
import com.curvemarket.domain.model.LeveragedPosition;
import com.curvemarket.domain.model.MarketParameters;
import com.curvemarket.domain.model.MarketState;
import com.curvemarket.exception.ErrorCode;
import com.curvemarket.exception.GuardViolationException;
import com.curvemarket.exception.LifecycleException;
import com.curvemarket.exception.ValidationException;
import com.curvemarket.math.MarketMath;
import com.curvemarket.state.MarketStateStore;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Books leveraged positions against the virtual AMM.
 *
 * <p>A position of {@code collateral} at {@code leverage} buys {@code collateral * leverage}
 * of stable worth of shares and borrows {@code collateral * (leverage - 1)} from the lending
 * pool. Interest on the loan is simple and accrues per second at the configured annual rate.
 *
 * <p>Health factor, in basis points:
 * <pre>
 *   value = shares * price(side)
 *   debt  = loan + accrued interest
 *   HF    = value * 10000 / (debt * liquidationThreshold / 10000)
 * </pre>
 * A position with HF below 10000 can be liquidated by anyone.
 *
 * <p>This class only changes market state. Moving money for the results it returns is the
 * caller's job.
 */
@Component
public class PositionLedger {

    private static final Logger log = LoggerFactory.getLogger(PositionLedger.class);

    private final MarketStateStore store;
    private final VirtualAmm amm;

    public PositionLedger(MarketStateStore store, VirtualAmm amm) {
        this.store = store;
        this.amm = amm;
    }

    /** A freshly opened position and the AMM trade that filled it. */
    public record OpenedPosition(LeveragedPosition position, AmmTrade trade) {}

    public LeveragePreview preview(OutcomeSide side, BigInteger collateral, int leverage) {
        validateTerms(collateral, leverage);
        MarketParameters parameters = store.parameters();
        BigInteger notional = notionalOf(collateral, leverage);
        BigInteger loan = loanOf(collateral, leverage);
        BigInteger shares = amm.previewBuy(side, notional);
        BigInteger entryPrice = shares.signum() == 0 ? BigInteger.ZERO : notional.multiply(MarketMath.WAD).divide(shares);
        BigInteger value = MarketMath.toExternal(shares.multiply(amm.priceOf(side)).divide(MarketMath.WAD));
        BigInteger healthFactor = MarketMath.healthFactor(value, loan, parameters.getLiquidationThresholdBps());
        return new LeveragePreview(side, collateral, leverage, notional, loan, shares, entryPrice, healthFactor);
    }

    public OpenedPosition open(
            String trader, OutcomeSide side, BigInteger collateral, int leverage, BigInteger minShares, Instant now) {
        if (store.findActivePosition(trader, side).isPresent()) {
            throw new LifecycleException(
                    ErrorCode.POSITION_ALREADY_ACTIVE, trader + " already holds an active " + side + " position");
        }
        validateTerms(collateral, leverage);

        BigInteger notional = notionalOf(collateral, leverage);
        BigInteger loan = loanOf(collateral, leverage);
        AmmTrade trade = amm.buy(side, notional);
        BigInteger shares = trade.amountOut();
        if (minShares != null && shares.compareTo(minShares) < 0) {
            throw new GuardViolationException(
                    ErrorCode.SLIPPAGE_EXCEEDED, "Received " + shares + " shares, minimum was " + minShares);
        }

        LeveragedPosition position = LeveragedPosition.builder()
                .trader(trader)
                .side(side)
                .collateral(collateral)
                .loanAmount(loan)
                .shares(shares)
                .entryPrice(notional.multiply(MarketMath.WAD).divide(shares))
                .leverage(leverage)
                .openedAt(now)
                .active(true)
                .build();
        store.savePosition(position);

        MarketState state = store.state();
        state.setOpenInterest(side, state.openInterestOf(side).add(shares));
        state.setTotalBorrowed(state.getTotalBorrowed().add(loan));
        log.info("Opened {} position for {}: collateral={}, leverage={}x, shares={}",
                side, trader, collateral, leverage, shares);
        return new OpenedPosition(position.toBuilder().build(), trade);
    }

    public LeveragedPosition requireActive(String trader, OutcomeSide side) {
        return store.findActivePosition(trader, side)
                .orElseThrow(() -> new LifecycleException(
                        ErrorCode.NO_ACTIVE_POSITION, trader + " has no active " + side + " position"));
    }

    /** Interest owed on {@code position} at {@code asOf}, external units. */
    public BigInteger accruedInterest(LeveragedPosition position, Instant asOf) {
        long elapsed = Duration.between(position.getOpenedAt(), asOf).getSeconds();
        return MarketMath.simpleInterest(position.getLoanAmount(), store.parameters().getBorrowRateBps(), elapsed);
    }

    public BigInteger healthFactor(String trader, OutcomeSide side, Instant now) {
        return healthFactor(requireActive(trader, side), now);
    }

    public BigInteger healthFactor(LeveragedPosition position, Instant now) {
        BigInteger value = MarketMath.toExternal(
                position.getShares().multiply(amm.priceOf(position.getSide())).divide(MarketMath.WAD));
        BigInteger debt = position.getLoanAmount().add(accruedInterest(position, now));
        return MarketMath.healthFactor(value, debt, store.parameters().getLiquidationThresholdBps());
    }

    public boolean isLiquidatable(LeveragedPosition position, Instant now) {
        return position.isActive() && healthFactor(position, now).compareTo(MarketMath.BPS_DENOMINATOR) < 0;
    }

    /** Sells the trader's shares and deactivates the position. */
    public PositionSettlement close(String trader, OutcomeSide side, Instant now) {
        return unwind(requireActive(trader, side), now);
    }

    /**
     * Unwinds an unhealthy position and splits whatever is left after the loan: a share for
     * insurance, a share for the keeper, the rest back to the trader.
     */
    public LiquidationSettlement liquidate(String trader, OutcomeSide side, Instant now) {
        LeveragedPosition position = requireActive(trader, side);
        BigInteger healthFactor = healthFactor(position, now);
        if (healthFactor.compareTo(MarketMath.BPS_DENOMINATOR) >= 0) {
            throw new GuardViolationException(
                    ErrorCode.POSITION_HEALTHY,
                    trader + " " + side + " position is healthy (health factor " + healthFactor + ")");
        }
        PositionSettlement settlement = unwind(position, now);
        MarketParameters parameters = store.parameters();
        BigInteger insuranceFee = MarketMath.bps(settlement.surplus(), parameters.getLiquidationFeeBps());
        BigInteger keeperReward = MarketMath.bps(settlement.surplus(), parameters.getKeeperRewardBps());
        BigInteger traderRefund = settlement.surplus().subtract(insuranceFee).subtract(keeperReward);
        return new LiquidationSettlement(settlement, insuranceFee, keeperReward, traderRefund);
    }

    /** Clears a position from the open-interest and borrowing totals and marks it inactive. */
    public void deactivate(LeveragedPosition position) {
        LeveragedPosition stored = requireActive(position.getTrader(), position.getSide());
        stored.setActive(false);
        MarketState state = store.state();
        state.setOpenInterest(stored.getSide(), state.openInterestOf(stored.getSide()).subtract(stored.getShares()));
        state.setTotalBorrowed(state.getTotalBorrowed().subtract(stored.getLoanAmount()));
    }

    private PositionSettlement unwind(LeveragedPosition position, Instant now) {
        LeveragedPosition before = position.toBuilder().build();
        AmmTrade trade = amm.sell(position.getSide(), position.getShares());
        BigInteger proceeds = MarketMath.toExternal(trade.amountOut());
        BigInteger principal = position.getLoanAmount();
        BigInteger interest = accruedInterest(position, now);
        BigInteger debt = principal.add(interest);
        BigInteger shortfall = MarketMath.positiveOrZero(debt.subtract(proceeds));
        BigInteger surplus = MarketMath.positiveOrZero(proceeds.subtract(debt));
        deactivate(position);
        return new PositionSettlement(before, trade, proceeds, principal, interest, shortfall, surplus);
    }

    private void validateTerms(BigInteger collateral, int leverage) {
        MarketParameters parameters = store.parameters();
        if (collateral == null || collateral.compareTo(parameters.getMinCollateral()) < 0) {
            throw new ValidationException(
                    ErrorCode.COLLATERAL_BELOW_MINIMUM,
                    "Collateral " + collateral + " is below the minimum " + parameters.getMinCollateral());
        }
        if (leverage < 1 || leverage > parameters.getMaxLeverage()) {
            throw new ValidationException(
                    ErrorCode.LEVERAGE_OUT_OF_BOUNDS,
                    "Leverage " + leverage + "x outside 1.." + parameters.getMaxLeverage());
        }
    }

    private static BigInteger notionalOf(BigInteger collateral, int leverage) {
        return MarketMath.toAccounting(collateral.multiply(BigInteger.valueOf(leverage)));
    }

    private static BigInteger loanOf(BigInteger collateral, int leverage) {
        return collateral.multiply(BigInteger.valueOf(leverage - 1L));
    }
}
