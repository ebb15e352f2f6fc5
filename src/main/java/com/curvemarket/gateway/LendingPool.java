package com.curvemarket.gateway;

import java.math.BigInteger;

/** Source of the borrowed part of a leveraged position. Amounts in external units. */
public interface LendingPool {

    void fundLoan(BigInteger amount);

    void repayLoan(BigInteger principal, BigInteger interest);
}
