package com.curvemarket.event;

import com.curvemarket.domain.enums.OutcomeSide;
import java.math.BigInteger;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Published after every AMM trade once the complementary reserve has been rebalanced.
 * {@code clamped} is set when the traded side hit the price ceiling.
 */
@Getter
public class AmmRebalanceEvent extends ApplicationEvent {

    private final OutcomeSide tradedSide;
    private final BigInteger priceYes;
    private final BigInteger priceNo;
    private final boolean clamped;

    public AmmRebalanceEvent(
            Object source, OutcomeSide tradedSide, BigInteger priceYes, BigInteger priceNo, boolean clamped) {
        super(source);
        this.tradedSide = tradedSide;
        this.priceYes = priceYes;
        this.priceNo = priceNo;
        this.clamped = clamped;
    }
}
