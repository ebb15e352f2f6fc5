package com.curvemarket.gateway;

import java.math.BigInteger;

/** Per-side claim token minted by the bonding curve. Only the market mints and burns. */
public interface OutcomeToken {

    String symbol();

    void mint(String to, BigInteger amount);

    void burn(String from, BigInteger amount);

    BigInteger balanceOf(String holder);

    BigInteger totalSupply();

    void transfer(String from, String to, BigInteger amount);
}
