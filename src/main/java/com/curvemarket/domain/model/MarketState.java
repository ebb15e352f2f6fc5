package com.curvemarket.domain.model;

import com.curvemarket.domain.enums.MarketPhase;
import com.curvemarket.domain.enums.OutcomeSide;
import java.math.BigInteger;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Mutable aggregate state of a single market.
 *
 * <p>Only engine components mutate this object, and only while the engine holds its
 * call lock. Reads from outside go through {@link MarketSnapshot}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MarketState {

    private boolean initialized;
    private int parametersVersion;
    private String authority;

    @Builder.Default
    private MarketPhase phase = MarketPhase.PRE_MIGRATION;

    // Phase 1
    @Builder.Default
    private BigInteger currentSupply = BigInteger.ZERO;

    /** Curve capital collected so far, accounting units, fees excluded. */
    @Builder.Default
    private BigInteger totalCapitalRaised = BigInteger.ZERO;

    private boolean migrated;

    // Phase 2
    @Builder.Default
    private BigInteger reserveStable = BigInteger.ZERO;

    @Builder.Default
    private BigInteger reserveYes = BigInteger.ZERO;

    @Builder.Default
    private BigInteger reserveNo = BigInteger.ZERO;

    /** Product of the seeded reserves, recorded at migration for reference. */
    @Builder.Default
    private BigInteger invariantK = BigInteger.ZERO;

    /** Outstanding loan principal across active positions, external units. */
    @Builder.Default
    private BigInteger totalBorrowed = BigInteger.ZERO;

    @Builder.Default
    private BigInteger openInterestYes = BigInteger.ZERO;

    @Builder.Default
    private BigInteger openInterestNo = BigInteger.ZERO;

    // Resolution
    private OutcomeSide winningSide;

    @Builder.Default
    private BigInteger settlementPrice = BigInteger.ZERO;

    /** External units left over for tier bonuses once liabilities are priced. */
    @Builder.Default
    private BigInteger bonusReserve = BigInteger.ZERO;

    private Instant resolvedAt;

    public boolean isResolved() {
        return phase == MarketPhase.RESOLVED;
    }

    public BigInteger reserveOf(OutcomeSide side) {
        return side == OutcomeSide.YES ? reserveYes : reserveNo;
    }

    public void setReserve(OutcomeSide side, BigInteger value) {
        if (side == OutcomeSide.YES) {
            reserveYes = value;
        } else {
            reserveNo = value;
        }
    }

    public BigInteger openInterestOf(OutcomeSide side) {
        return side == OutcomeSide.YES ? openInterestYes : openInterestNo;
    }

    public void setOpenInterest(OutcomeSide side, BigInteger value) {
        if (side == OutcomeSide.YES) {
            openInterestYes = value;
        } else {
            openInterestNo = value;
        }
    }
}
