package com.curvemarket.event;

import com.curvemarket.domain.enums.ClaimKind;
import com.curvemarket.domain.enums.OutcomeSide;
import com.curvemarket.domain.model.LeveragedPosition;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory for market events with commit-time delivery.
 *
 * <p>The engine stages events while an operation runs. {@link #flush()} hands them to
 * Spring's {@link ApplicationEventPublisher} after the operation has committed;
 * {@link #discard()} drops them when the operation is rolled back, so listeners never
 * observe a change that did not happen.
 *
 * <p>Callers must hold the engine call lock.
 */
@Component
public class MarketEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;
    private final List<ApplicationEvent> pending = new ArrayList<>();

    public MarketEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Phase 1 ----

    public void stageCurveBuy(
            Object source,
            String buyer,
            OutcomeSide side,
            BigInteger shares,
            BigInteger rawCost,
            BigInteger fee,
            BigInteger supplyAfter,
            BigInteger capitalRaisedAfter) {
        pending.add(new CurveBuyEvent(source, buyer, side, shares, rawCost, fee, supplyAfter, capitalRaisedAfter));
    }

    public void stageMigration(
            Object source,
            BigInteger capitalRaised,
            BigInteger reserveStable,
            BigInteger reserveYes,
            BigInteger reserveNo,
            BigInteger invariantK) {
        pending.add(new MigrationEvent(source, capitalRaised, reserveStable, reserveYes, reserveNo, invariantK));
    }

    // ---- AMM ----

    public void stageRebalance(
            Object source, OutcomeSide tradedSide, BigInteger priceYes, BigInteger priceNo, boolean clamped) {
        pending.add(new AmmRebalanceEvent(source, tradedSide, priceYes, priceNo, clamped));
    }

    // ---- Positions ----

    public void stagePosition(
            Object source, LeveragedPosition position, PositionEventType eventType, Map<String, Object> details) {
        pending.add(new PositionEvent(source, position.toBuilder().build(), eventType, details));
    }

    // ---- Settlement ----

    public void stageResolution(
            Object source,
            OutcomeSide winningSide,
            BigInteger settlementPrice,
            BigInteger backing,
            BigInteger liabilities,
            BigInteger bonusReserve) {
        pending.add(new ResolutionEvent(source, winningSide, settlementPrice, backing, liabilities, bonusReserve));
    }

    public void stageClaim(
            Object source,
            ClaimEventType eventType,
            String account,
            ClaimKind claimKind,
            BigInteger payout,
            BigInteger bonus) {
        pending.add(new ClaimEvent(source, eventType, account, claimKind, payout, bonus));
    }

    // ---- Authority ----

    public void stageAuthorityRotated(Object source, String previousAuthority, String newAuthority) {
        pending.add(new AuthorityRotatedEvent(source, previousAuthority, newAuthority));
    }

    public int pendingCount() {
        return pending.size();
    }

    /** Publishes staged events in the order they were staged. */
    public void flush() {
        List<ApplicationEvent> committed = new ArrayList<>(pending);
        pending.clear();
        committed.forEach(applicationEventPublisher::publishEvent);
    }

    public void discard() {
        pending.clear();
    }
}
