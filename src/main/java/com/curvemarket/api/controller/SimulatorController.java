package com.curvemarket.api.controller;

import com.curvemarket.auth.Addresses;
import com.curvemarket.exception.ErrorCode;
import com.curvemarket.exception.ValidationException;
import com.curvemarket.simulator.SimulatedSettlementBank;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Faucet and balance views for the in-process settlement simulator.
 *
 * <ul>
 *   <li>POST /api/simulator/wallets/{address}/fund?amount= -- credit accounting units to a wallet</li>
 *   <li>GET /api/simulator/wallets/{address} -- wallet and payout balances</li>
 *   <li>GET /api/simulator/funds?market= -- market holdings, insurance and lending figures</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/simulator")
@ConditionalOnProperty(name = "curvemarket.simulator.enabled", havingValue = "true", matchIfMissing = true)
public class SimulatorController {

    private static final Logger log = LoggerFactory.getLogger(SimulatorController.class);

    private final SimulatedSettlementBank bank;

    public SimulatorController(SimulatedSettlementBank bank) {
        this.bank = bank;
    }

    @PostMapping("/wallets/{address}/fund")
    public ResponseEntity<Map<String, Object>> fundWallet(
            @PathVariable String address, @RequestParam BigInteger amount) {
        if (amount.signum() <= 0) {
            throw new ValidationException(ErrorCode.ZERO_AMOUNT, "Funding amount must be positive");
        }
        String wallet = Addresses.normalize(address);
        bank.fundWallet(wallet, amount);
        log.info("Faucet credited {} to {}", amount, wallet);
        return getWallet(wallet);
    }

    @GetMapping("/wallets/{address}")
    public ResponseEntity<Map<String, Object>> getWallet(@PathVariable String address) {
        String wallet = Addresses.normalize(address);
        Map<String, Object> balances = new LinkedHashMap<>();
        balances.put("address", wallet);
        balances.put("walletBalance", bank.walletBalance(wallet));
        balances.put("payoutBalance", bank.payoutBalance(wallet));
        return ResponseEntity.ok(balances);
    }

    @GetMapping("/funds")
    public ResponseEntity<Map<String, Object>> getFunds(@RequestParam String market) {
        Map<String, Object> funds = new LinkedHashMap<>();
        funds.put("marketHoldings", bank.marketHoldings(Addresses.normalize(market)));
        funds.put("custody", bank.custodyBalance());
        funds.put("insurance", bank.insuranceBalance());
        funds.put("lendingAvailable", bank.lendingAvailable());
        funds.put("outstandingLoans", bank.outstandingLoans());
        funds.put("interestEarned", bank.interestEarned());
        return ResponseEntity.ok(funds);
    }
}
