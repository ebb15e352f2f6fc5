package com.curvemarket.event;

import com.curvemarket.domain.enums.OutcomeSide;
import java.math.BigInteger;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/** Published once, when the authority fixes the outcome and the settlement price is frozen. */
@Getter
public class ResolutionEvent extends ApplicationEvent {

    private final OutcomeSide winningSide;
    private final BigInteger settlementPrice;
    private final BigInteger backing;
    private final BigInteger liabilities;
    private final BigInteger bonusReserve;

    public ResolutionEvent(
            Object source,
            OutcomeSide winningSide,
            BigInteger settlementPrice,
            BigInteger backing,
            BigInteger liabilities,
            BigInteger bonusReserve) {
        super(source);
        this.winningSide = winningSide;
        this.settlementPrice = settlementPrice;
        this.backing = backing;
        this.liabilities = liabilities;
        this.bonusReserve = bonusReserve;
    }
}
