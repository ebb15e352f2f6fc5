package com.curvemarket.simulator;

import com.curvemarket.exception.ErrorCode;
import com.curvemarket.exception.LifecycleException;
import com.curvemarket.exception.SolvencyException;
import com.curvemarket.gateway.CustodyVault;
import com.curvemarket.gateway.InsuranceFund;
import com.curvemarket.gateway.LendingPool;
import com.curvemarket.math.MarketMath;
import com.curvemarket.state.RollbackSupport;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process stand-in for the vault, the lending pool and the insurance fund of one market.
 *
 * <p>Every balance lives in a single ledger keyed by account name:
 * <ul>
 *   <li>{@code wallet:<address>} trader accounting-unit balances</li>
 *   <li>{@code custody} accounting units collected but not yet redeemed</li>
 *   <li>{@code holdings:<market>} external units backing the market</li>
 *   <li>{@code payout:<address>} external units paid to traders and keepers</li>
 *   <li>{@code insurance}, {@code lending:available}, {@code lending:outstanding}, {@code lending:interest}</li>
 * </ul>
 * Borrowed money and insurance cover flow into the market holdings; fees, repayments and
 * payouts flow out of them.
 *
 * <p>The lending pool refuses loans that would push utilisation above
 * {@code maxUtilisationBps} of its deposits.
 */
public class SimulatedSettlementBank implements CustodyVault, LendingPool, InsuranceFund, RollbackSupport {

    private static final Logger log = LoggerFactory.getLogger(SimulatedSettlementBank.class);

    private static final String CUSTODY = "custody";
    private static final String INSURANCE = "insurance";
    private static final String LENDING_AVAILABLE = "lending:available";
    private static final String LENDING_OUTSTANDING = "lending:outstanding";
    private static final String LENDING_INTEREST = "lending:interest";

    private final String marketAddress;
    private final BigInteger lendingDeposits;
    private final int maxUtilisationBps;

    private final Map<String, BigInteger> ledger = new HashMap<>();
    private final Set<String> releasedMarkets = new HashSet<>();

    public SimulatedSettlementBank(
            String marketAddress, BigInteger lendingDeposits, BigInteger insuranceBalance, int maxUtilisationBps) {
        this.marketAddress = marketAddress;
        this.lendingDeposits = lendingDeposits;
        this.maxUtilisationBps = maxUtilisationBps;
        ledger.put(LENDING_AVAILABLE, lendingDeposits);
        ledger.put(INSURANCE, insuranceBalance);
    }

    // ---- Faucet and queries ----

    public synchronized void fundWallet(String address, BigInteger accountingAmount) {
        credit(wallet(address), accountingAmount);
        log.debug("Funded wallet {} with {}", address, accountingAmount);
    }

    public synchronized BigInteger walletBalance(String address) {
        return balance(wallet(address));
    }

    public synchronized BigInteger payoutBalance(String address) {
        return balance(payout(address));
    }

    public synchronized BigInteger custodyBalance() {
        return balance(CUSTODY);
    }

    public synchronized BigInteger insuranceBalance() {
        return balance(INSURANCE);
    }

    public synchronized BigInteger lendingAvailable() {
        return balance(LENDING_AVAILABLE);
    }

    public synchronized BigInteger outstandingLoans() {
        return balance(LENDING_OUTSTANDING);
    }

    public synchronized BigInteger interestEarned() {
        return balance(LENDING_INTEREST);
    }

    // ---- CustodyVault ----

    @Override
    public synchronized void collect(String from, BigInteger accountingAmount) {
        debit(wallet(from), accountingAmount, ErrorCode.INSUFFICIENT_BALANCE);
        credit(CUSTODY, accountingAmount);
    }

    @Override
    public synchronized BigInteger redeem(BigInteger accountingAmount) {
        debit(CUSTODY, accountingAmount, ErrorCode.INSUFFICIENT_BALANCE);
        BigInteger external = MarketMath.toExternal(accountingAmount);
        credit(holdings(marketAddress), external);
        return external;
    }

    @Override
    public synchronized void deposit(String recipient, BigInteger externalAmount) {
        debit(holdings(marketAddress), externalAmount, ErrorCode.INSUFFICIENT_LIQUIDITY);
        credit(payout(recipient), externalAmount);
    }

    @Override
    public synchronized void transferToMarketOnce(String market, BigInteger externalAmount) {
        if (!releasedMarkets.add(market.toLowerCase(Locale.ROOT))) {
            throw new LifecycleException(
                    ErrorCode.MARKET_ALREADY_MIGRATED, "Curve capital for " + market + " was already released");
        }
        debit(CUSTODY, MarketMath.toAccounting(externalAmount), ErrorCode.INSUFFICIENT_BALANCE);
        credit(holdings(market), externalAmount);
    }

    @Override
    public synchronized BigInteger marketHoldings(String market) {
        return balance(holdings(market));
    }

    // ---- LendingPool ----

    @Override
    public synchronized void fundLoan(BigInteger amount) {
        BigInteger cap = MarketMath.bps(lendingDeposits, maxUtilisationBps);
        BigInteger afterLoan = balance(LENDING_OUTSTANDING).add(amount);
        if (afterLoan.compareTo(cap) > 0) {
            throw new SolvencyException(
                    ErrorCode.LOAN_CAP_EXCEEDED,
                    "Loan of " + amount + " would lift utilisation to " + afterLoan + " above cap " + cap);
        }
        debit(LENDING_AVAILABLE, amount, ErrorCode.INSUFFICIENT_LIQUIDITY);
        credit(LENDING_OUTSTANDING, amount);
        credit(holdings(marketAddress), amount);
    }

    @Override
    public synchronized void repayLoan(BigInteger principal, BigInteger interest) {
        debit(holdings(marketAddress), principal.add(interest), ErrorCode.INSUFFICIENT_LIQUIDITY);
        debit(LENDING_OUTSTANDING, principal, ErrorCode.INSUFFICIENT_BALANCE);
        credit(LENDING_AVAILABLE, principal.add(interest));
        credit(LENDING_INTEREST, interest);
    }

    // ---- InsuranceFund ----

    @Override
    public synchronized void depositFee(BigInteger amount) {
        debit(holdings(marketAddress), amount, ErrorCode.INSUFFICIENT_LIQUIDITY);
        credit(INSURANCE, amount);
    }

    @Override
    public synchronized void coverBadDebt(BigInteger amount) {
        debit(INSURANCE, amount, ErrorCode.INSUFFICIENT_INSURANCE_FUNDS);
        credit(holdings(marketAddress), amount);
    }

    @Override
    public synchronized Runnable checkpoint() {
        Map<String, BigInteger> savedLedger = new HashMap<>(ledger);
        Set<String> savedReleased = new HashSet<>(releasedMarkets);
        return () -> {
            synchronized (this) {
                ledger.clear();
                ledger.putAll(savedLedger);
                releasedMarkets.clear();
                releasedMarkets.addAll(savedReleased);
            }
        };
    }

    private BigInteger balance(String account) {
        return ledger.getOrDefault(account, BigInteger.ZERO);
    }

    private void credit(String account, BigInteger amount) {
        ledger.merge(account, amount, BigInteger::add);
    }

    private void debit(String account, BigInteger amount, ErrorCode shortfallCode) {
        BigInteger balance = balance(account);
        if (balance.compareTo(amount) < 0) {
            throw new SolvencyException(
                    shortfallCode, "Account " + account + " holds " + balance + ", cannot debit " + amount);
        }
        ledger.put(account, balance.subtract(amount));
    }

    private static String wallet(String address) {
        return "wallet:" + address.toLowerCase(Locale.ROOT);
    }

    private static String holdings(String market) {
        return "holdings:" + market.toLowerCase(Locale.ROOT);
    }

    private static String payout(String address) {
        return "payout:" + address.toLowerCase(Locale.ROOT);
    }
}
