package com.curvemarket.api.dto.response;

import com.curvemarket.domain.enums.OutcomeSide;
import com.curvemarket.domain.model.LeveragedPosition;
import java.math.BigInteger;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** A leveraged position with its current health factor (null once inactive). */
@Getter
@Builder
public class PositionResponse {

    private final String trader;
    private final OutcomeSide side;
    private final BigInteger collateral;
    private final BigInteger loanAmount;
    private final BigInteger shares;
    private final BigInteger entryPrice;
    private final int leverage;
    private final Instant openedAt;
    private final boolean active;
    private final BigInteger healthFactor;

    public static PositionResponse of(LeveragedPosition position, BigInteger healthFactor) {
        return PositionResponse.builder()
                .trader(position.getTrader())
                .side(position.getSide())
                .collateral(position.getCollateral())
                .loanAmount(position.getLoanAmount())
                .shares(position.getShares())
                .entryPrice(position.getEntryPrice())
                .leverage(position.getLeverage())
                .openedAt(position.getOpenedAt())
                .active(position.isActive())
                .healthFactor(healthFactor)
                .build();
    }
}
