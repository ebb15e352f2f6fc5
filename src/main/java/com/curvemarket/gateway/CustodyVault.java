package com.curvemarket.gateway;

import java.math.BigInteger;

/**
 * Custody of trader money on behalf of the market.
 *
 * <p>Traders hold an accounting-unit stable token (18 decimals). The vault pulls it with
 * {@link #collect}, converts it to the external settlement currency (6 decimals) with
 * {@link #redeem}, and pays external units out with {@link #deposit}. The market's settlement
 * backing is whatever the vault reports through {@link #marketHoldings}.
 */
public interface CustodyVault {

    /** Pulls {@code accountingAmount} from {@code from} into vault custody. */
    void collect(String from, BigInteger accountingAmount);

    /** Converts collected accounting units into external units held for the market. */
    BigInteger redeem(BigInteger accountingAmount);

    /** Pays {@code externalAmount} from the market's holdings to {@code recipient}. */
    void deposit(String recipient, BigInteger externalAmount);

    /** Releases the curve capital to the market. Fails when called a second time for the same market. */
    void transferToMarketOnce(String market, BigInteger externalAmount);

    BigInteger marketHoldings(String market);
}
