package com.curvemarket.event;

import java.math.BigInteger;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/** Published once, when curve capital seeds the virtual AMM. */
@Getter
public class MigrationEvent extends ApplicationEvent {

    private final BigInteger capitalRaised;
    private final BigInteger reserveStable;
    private final BigInteger reserveYes;
    private final BigInteger reserveNo;
    private final BigInteger invariantK;

    public MigrationEvent(
            Object source,
            BigInteger capitalRaised,
            BigInteger reserveStable,
            BigInteger reserveYes,
            BigInteger reserveNo,
            BigInteger invariantK) {
        super(source);
        this.capitalRaised = capitalRaised;
        this.reserveStable = reserveStable;
        this.reserveYes = reserveYes;
        this.reserveNo = reserveNo;
        this.invariantK = invariantK;
    }
}
