package com.curvemarket.gateway;

import java.math.BigInteger;

/**
 * Collects protocol fees and absorbs bad debt. Amounts in external units.
 * {@link #coverBadDebt} fails with {@code INSUFFICIENT_INSURANCE_FUNDS} when the fund is short.
 */
public interface InsuranceFund {

    void depositFee(BigInteger amount);

    void coverBadDebt(BigInteger amount);
}
