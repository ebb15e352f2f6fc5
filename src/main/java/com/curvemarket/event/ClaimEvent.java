package com.curvemarket.event;

import com.curvemarket.domain.enums.ClaimKind;
import java.math.BigInteger;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/** Published for every settlement claim and sweep. Amounts in external units. */
@Getter
public class ClaimEvent extends ApplicationEvent {

    private final ClaimEventType eventType;
    private final String account;
    private final ClaimKind claimKind;
    private final BigInteger payout;
    private final BigInteger bonus;

    public ClaimEvent(
            Object source,
            ClaimEventType eventType,
            String account,
            ClaimKind claimKind,
            BigInteger payout,
            BigInteger bonus) {
        super(source);
        this.eventType = eventType;
        this.account = account;
        this.claimKind = claimKind;
        this.payout = payout;
        this.bonus = bonus;
    }
}
