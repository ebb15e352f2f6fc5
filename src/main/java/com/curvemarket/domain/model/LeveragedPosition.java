package com.curvemarket.domain.model;

import com.curvemarket.domain.enums.OutcomeSide;
import java.math.BigInteger;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A leveraged long on one outcome side, bought through the virtual AMM.
 *
 * <p>Collateral and loan are in external units; shares and entry price in accounting
 * units. Once {@code active} turns false the record is kept for queries but can never
 * be closed, liquidated or claimed again.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LeveragedPosition {

    private String trader;
    private OutcomeSide side;

    private BigInteger collateral;

    /** Principal borrowed from the lending pool: {@code collateral * (leverage - 1)}. */
    private BigInteger loanAmount;

    private BigInteger shares;

    /** Stable paid per share at open, WAD-scaled. */
    private BigInteger entryPrice;

    private int leverage;

    /** Interest accrues from this instant. */
    private Instant openedAt;

    private boolean active;

    public PositionKey key() {
        return new PositionKey(trader, side);
    }
}
