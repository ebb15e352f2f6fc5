package com.curvemarket.event;

import com.curvemarket.domain.enums.OutcomeSide;
import java.math.BigInteger;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/** Published after a bonding-curve purchase commits. Amounts in accounting units. */
@Getter
public class CurveBuyEvent extends ApplicationEvent {

    private final String buyer;
    private final OutcomeSide side;
    private final BigInteger shares;
    private final BigInteger rawCost;
    private final BigInteger fee;
    private final BigInteger supplyAfter;
    private final BigInteger capitalRaisedAfter;

    public CurveBuyEvent(
            Object source,
            String buyer,
            OutcomeSide side,
            BigInteger shares,
            BigInteger rawCost,
            BigInteger fee,
            BigInteger supplyAfter,
            BigInteger capitalRaisedAfter) {
        super(source);
        this.buyer = buyer;
        this.side = side;
        this.shares = shares;
        this.rawCost = rawCost;
        this.fee = fee;
        this.supplyAfter = supplyAfter;
        this.capitalRaisedAfter = capitalRaisedAfter;
    }
}
