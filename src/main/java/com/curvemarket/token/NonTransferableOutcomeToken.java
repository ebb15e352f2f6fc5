package com.curvemarket.token;

import com.curvemarket.exception.ErrorCode;
import com.curvemarket.exception.GuardViolationException;
import com.curvemarket.exception.SolvencyException;
import com.curvemarket.gateway.OutcomeToken;
import com.curvemarket.state.RollbackSupport;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Outcome token that can be minted and burned by the market but never moved between holders.
 * Balances are accounting units.
 */
public class NonTransferableOutcomeToken implements OutcomeToken, RollbackSupport {

    private final String symbol;
    private final Map<String, BigInteger> balances = new HashMap<>();
    private BigInteger totalSupply = BigInteger.ZERO;

    public NonTransferableOutcomeToken(String symbol) {
        this.symbol = symbol;
    }

    @Override
    public String symbol() {
        return symbol;
    }

    @Override
    public synchronized void mint(String to, BigInteger amount) {
        balances.merge(to, amount, BigInteger::add);
        totalSupply = totalSupply.add(amount);
    }

    @Override
    public synchronized void burn(String from, BigInteger amount) {
        BigInteger balance = balanceOf(from);
        if (balance.compareTo(amount) < 0) {
            throw new SolvencyException(
                    ErrorCode.INSUFFICIENT_BALANCE,
                    symbol + " balance of " + from + " is " + balance + ", cannot burn " + amount);
        }
        balances.put(from, balance.subtract(amount));
        totalSupply = totalSupply.subtract(amount);
    }

    @Override
    public synchronized BigInteger balanceOf(String holder) {
        return balances.getOrDefault(holder, BigInteger.ZERO);
    }

    @Override
    public synchronized BigInteger totalSupply() {
        return totalSupply;
    }

    @Override
    public void transfer(String from, String to, BigInteger amount) {
        throw new GuardViolationException(ErrorCode.TRANSFER_DISABLED, symbol + " outcome tokens are not transferable");
    }

    @Override
    public synchronized Runnable checkpoint() {
        Map<String, BigInteger> savedBalances = new HashMap<>(balances);
        BigInteger savedSupply = totalSupply;
        return () -> {
            synchronized (this) {
                balances.clear();
                balances.putAll(savedBalances);
                totalSupply = savedSupply;
            }
        };
    }
}
