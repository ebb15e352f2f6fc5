package com.curvemarket.gateway;

import com.curvemarket.math.MarketMath;
import com.curvemarket.state.MarketStateStore;
import java.math.BigInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Moves money between traders, the vault, the lending pool and the insurance fund.
 *
 * <p>The engine calls the router only after it has finished updating market state for an
 * operation. Every method is a no-op for a zero amount so callers do not have to guard
 * against empty legs.
 *
 * <p>Fee legs take two hops: accounting units are redeemed into external units first and
 * only then handed to the insurance fund.
 */
@Component
public class FundsRouter {

    private static final Logger log = LoggerFactory.getLogger(FundsRouter.class);

    private final CustodyVault custodyVault;
    private final LendingPool lendingPool;
    private final InsuranceFund insuranceFund;
    private final MarketStateStore store;

    public FundsRouter(
            CustodyVault custodyVault, LendingPool lendingPool, InsuranceFund insuranceFund, MarketStateStore store) {
        this.custodyVault = custodyVault;
        this.lendingPool = lendingPool;
        this.insuranceFund = insuranceFund;
        this.store = store;
    }

    public String marketAddress() {
        return store.parameters().getMarketAddress();
    }

    // ---- Phase 1 ----

    /** Pulls curve cost plus fee from the buyer and forwards the fee to insurance. */
    public void collectCurvePayment(String buyer, BigInteger rawCost, BigInteger fee) {
        custodyVault.collect(buyer, rawCost.add(fee));
        forwardFee(fee);
    }

    /** Hands the curve capital to the market. The vault rejects a second release. */
    public void releaseCurveCapital(BigInteger raisedAccounting) {
        BigInteger external = MarketMath.toExternal(raisedAccounting);
        log.info("Releasing curve capital {} (external) to market {}", external, marketAddress());
        custodyVault.transferToMarketOnce(marketAddress(), external);
    }

    // ---- Phase 2 ----

    public void postCollateral(String trader, BigInteger collateral) {
        BigInteger accounting = MarketMath.toAccounting(collateral);
        custodyVault.collect(trader, accounting);
        custodyVault.redeem(accounting);
    }

    public void fundLoan(BigInteger loan) {
        if (loan.signum() > 0) {
            lendingPool.fundLoan(loan);
        }
    }

    /**
     * Repays a loan in full. A shortfall is drawn from insurance first so the pool
     * always receives principal and interest.
     */
    public void settleDebt(BigInteger principal, BigInteger interest, BigInteger shortfall) {
        if (shortfall.signum() > 0) {
            log.warn("Covering bad debt of {} from insurance", shortfall);
            insuranceFund.coverBadDebt(shortfall);
        }
        if (principal.signum() > 0 || interest.signum() > 0) {
            lendingPool.repayLoan(principal, interest);
        }
    }

    public void pay(String recipient, BigInteger amount) {
        if (amount.signum() > 0) {
            custodyVault.deposit(recipient, amount);
        }
    }

    public void payInsurance(BigInteger amount) {
        if (amount.signum() > 0) {
            insuranceFund.depositFee(amount);
        }
    }

    public BigInteger settlementBacking() {
        return custodyVault.marketHoldings(marketAddress());
    }

    private void forwardFee(BigInteger feeAccounting) {
        if (feeAccounting.signum() == 0) {
            return;
        }
        BigInteger external = custodyVault.redeem(feeAccounting);
        payInsurance(external);
    }
}
