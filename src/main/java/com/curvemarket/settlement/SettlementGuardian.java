package com.curvemarket.settlement;

import com.curvemarket.domain.enums.MarketPhase;
import com.curvemarket.domain.enums.OutcomeSide;
import com.curvemarket.domain.enums.UserTier;
import com.curvemarket.domain.model.LeveragedPosition;
import com.curvemarket.domain.model.MarketParameters;
import com.curvemarket.domain.model.MarketState;
import com.curvemarket.exception.ErrorCode;
import com.curvemarket.exception.GuardViolationException;
import com.curvemarket.exception.LifecycleException;
import com.curvemarket.math.MarketMath;
import com.curvemarket.position.PositionLedger;
import com.curvemarket.state.MarketStateStore;
import java.math.BigInteger;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Freezes a solvency-capped settlement price at resolution and settles holdings against it.
 *
 * <p>At resolution:
 * <pre>
 *   liabilities     = winning outcome token supply + winning open interest  (external units, rounded up)
 *   settlementPrice = min(1, backing / liabilities)                         (WAD, 1 when nothing is owed)
 *   bonusReserve    = backing - liabilities * settlementPrice
 * </pre>
 * Every winning unit is paid the same price whatever the order of claims, and the sum of all
 * payouts cannot exceed the backing. Tier bonuses on leveraged positions are paid only from
 * the bonus reserve and stop when it is empty.
 *
 * <p>Interest on loans stops accruing at the resolution instant.
 */
@Component
public class SettlementGuardian {

    private static final Logger log = LoggerFactory.getLogger(SettlementGuardian.class);

    private final MarketStateStore store;
    private final PositionLedger positionLedger;

    public SettlementGuardian(MarketStateStore store, PositionLedger positionLedger) {
        this.store = store;
        this.positionLedger = positionLedger;
    }

    public Resolution resolve(OutcomeSide winningSide, BigInteger winningTokenSupply, BigInteger backing, Instant now) {
        MarketState state = store.state();
        BigInteger winningUnits = winningTokenSupply.add(state.openInterestOf(winningSide));
        BigInteger liabilities = MarketMath.ceilDiv(winningUnits, MarketMath.DECIMAL_MULTIPLIER);
        BigInteger price = settlementPrice(backing, liabilities);
        BigInteger bonusReserve =
                MarketMath.positiveOrZero(backing.subtract(liabilities.multiply(price).divide(MarketMath.WAD)));

        state.setPhase(MarketPhase.RESOLVED);
        state.setWinningSide(winningSide);
        state.setSettlementPrice(price);
        state.setBonusReserve(bonusReserve);
        state.setResolvedAt(now);
        log.info("Market resolved {}: backing={}, liabilities={}, settlementPrice={}, bonusReserve={}",
                winningSide, backing, liabilities, price, bonusReserve);
        return new Resolution(winningSide, price, backing, liabilities, bonusReserve);
    }

    public static BigInteger settlementPrice(BigInteger backing, BigInteger liabilities) {
        if (liabilities.signum() == 0) {
            return MarketMath.WAD;
        }
        return backing.multiply(MarketMath.WAD).divide(liabilities).min(MarketMath.WAD);
    }

    public void requireResolved() {
        if (!store.state().isResolved()) {
            throw new LifecycleException(ErrorCode.MARKET_NOT_RESOLVED, "Market has not been resolved");
        }
    }

    /** External payout for {@code balance} winning outcome tokens. */
    public BigInteger outcomeTokenPayout(BigInteger balance) {
        BigInteger accounting = balance.multiply(store.state().getSettlementPrice()).divide(MarketMath.WAD);
        return MarketMath.toExternal(accounting);
    }

    /** The caller's active position on the winning side. */
    public LeveragedPosition requireWinningPosition(String trader) {
        OutcomeSide winningSide = store.state().getWinningSide();
        return store.findActivePosition(trader, winningSide)
                .orElseThrow(() -> new LifecycleException(
                        ErrorCode.NO_WINNING_POSITION, trader + " holds no active " + winningSide + " position"));
    }

    /**
     * Settles an active position at the frozen price and deactivates it. A bonus is only
     * computed when {@code tier} is given and the holder nets a positive amount.
     */
    public PositionClaim settlePosition(LeveragedPosition position, UserTier tier) {
        MarketState state = store.state();
        MarketParameters parameters = store.parameters();

        BigInteger gross = BigInteger.ZERO;
        if (position.getSide() == state.getWinningSide()) {
            gross = MarketMath.toExternal(
                    position.getShares().multiply(state.getSettlementPrice()).divide(MarketMath.WAD));
        }
        BigInteger principal = position.getLoanAmount();
        BigInteger interest = positionLedger.accruedInterest(position, state.getResolvedAt());
        BigInteger debt = principal.add(interest);
        BigInteger shortfall = MarketMath.positiveOrZero(debt.subtract(gross));
        BigInteger net = MarketMath.positiveOrZero(gross.subtract(debt));

        BigInteger bonus = BigInteger.ZERO;
        if (tier != null && net.signum() > 0) {
            BigInteger base = MarketMath.bps(position.getCollateral(), parameters.getBonusYieldBps());
            bonus = MarketMath.bps(base, parameters.tierMultiplierBps(tier)).min(state.getBonusReserve());
            state.setBonusReserve(state.getBonusReserve().subtract(bonus));
        }

        LeveragedPosition before = position.toBuilder().build();
        positionLedger.deactivate(position);
        return new PositionClaim(before, gross, principal, interest, shortfall, net, bonus);
    }

    public void requireCoolingOffElapsed(Instant now) {
        Instant opensAt = store.state().getResolvedAt().plus(store.parameters().getCoolingOff());
        if (now.isBefore(opensAt)) {
            throw new GuardViolationException(
                    ErrorCode.COOLING_OFF_ACTIVE, "Unclaimed holdings can be swept from " + opensAt);
        }
    }
}
